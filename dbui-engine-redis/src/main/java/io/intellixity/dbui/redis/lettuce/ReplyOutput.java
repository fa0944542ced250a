package io.intellixity.dbui.redis.lettuce;

import io.intellixity.dbui.redis.RedisReply;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.output.CommandOutput;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds a {@link RedisReply} tree from Lettuce's streaming callbacks.\n
 *
 * Aggregates are tracked on a stack of expected element counts and closed when their last element arrives.\n
 */
final class ReplyOutput extends CommandOutput<String, String, RedisReply> {
  private enum Kind { ARRAY, MAP, SET }

  private static final class Frame {
    final Kind kind;
    final int expected;
    final List<RedisReply> items;

    Frame(Kind kind, int expected) {
      this.kind = kind;
      this.expected = expected;
      this.items = new ArrayList<>(expected);
    }

    boolean full() { return items.size() >= expected; }

    RedisReply build() {
      return switch (kind) {
        case ARRAY -> new RedisReply.Array(items);
        case SET -> new RedisReply.SetReply(items);
        case MAP -> {
          List<RedisReply.Entry> entries = new ArrayList<>(items.size() / 2);
          for (int i = 0; i + 1 < items.size(); i += 2) entries.add(new RedisReply.Entry(items.get(i), items.get(i + 1)));
          yield new RedisReply.MapReply(entries);
        }
      };
    }
  }

  private final Deque<Frame> stack = new ArrayDeque<>();

  ReplyOutput() {
    super(StringCodec.UTF8, null);
  }

  @Override
  public void set(ByteBuffer bytes) {
    add(bytes == null ? RedisReply.NIL : new RedisReply.Bulk(codec.decodeValue(bytes)));
  }

  @Override
  public void setSingle(ByteBuffer bytes) {
    add(bytes == null ? RedisReply.NIL : new RedisReply.Status(codec.decodeValue(bytes)));
  }

  @Override
  public void setBigNumber(ByteBuffer bytes) {
    add(bytes == null ? RedisReply.NIL : new RedisReply.BigNumber(codec.decodeValue(bytes)));
  }

  @Override
  public void set(long integer) {
    add(new RedisReply.Int(integer));
  }

  @Override
  public void set(double number) {
    add(new RedisReply.Double(number));
  }

  @Override
  public void set(boolean value) {
    add(new RedisReply.Bool(value));
  }

  @Override
  public void multi(int count) {
    open(Kind.ARRAY, count);
  }

  @Override
  public void multiArray(int count) {
    open(Kind.ARRAY, count);
  }

  @Override
  public void multiPush(int count) {
    open(Kind.ARRAY, count);
  }

  @Override
  public void multiSet(int count) {
    open(Kind.SET, count);
  }

  @Override
  public void multiMap(int count) {
    // count is the number of pairs
    open(Kind.MAP, count < 0 ? count : count * 2);
  }

  private void open(Kind kind, int count) {
    if (count < 0) {
      add(RedisReply.NIL);
      return;
    }
    Frame f = new Frame(kind, count);
    if (count == 0) {
      add(f.build());
    } else {
      stack.push(f);
    }
  }

  private void add(RedisReply r) {
    Frame top = stack.peek();
    if (top == null) {
      if (output == null) output = r;
      return;
    }
    top.items.add(r);
    if (top.full()) {
      stack.pop();
      add(top.build());
    }
  }
}
