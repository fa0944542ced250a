package io.intellixity.dbui.registry.command;

import io.intellixity.dbui.conn.ConnectionDescriptor;

import java.util.Optional;

/** Resolves saved connection descriptors by id. Owned by the configuration layer. */
@FunctionalInterface
public interface ConnectionDescriptorSource {
  Optional<ConnectionDescriptor> find(String connectionId);
}
