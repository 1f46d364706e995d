package io.relay.api.function;

import io.relay.api.exception.ArgumentCountException;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ActorMethodTableTest {

  private final ActorMethodTable<StringBuilder> table =
      ActorMethodTable.<StringBuilder>builder()
          .method("length", 0, (sb, args, block) -> sb.length())
          .method("append", 1, 2, (sb, args, block) -> sb.append(args))
          .variadic("appendAll", 1, (sb, args, block) -> sb.append(args))
          .build();

  @Test
  public void testLookup() {
    Assert.assertTrue(table.lookup("length").isPresent());
    Assert.assertFalse(table.lookup("reverse").isPresent());
    Assert.assertEquals(table.names().size(), 3);
    Assert.assertTrue(table.lookup("appendAll").get().isVariadic());
    Assert.assertFalse(table.lookup("append").get().isVariadic());
  }

  @Test
  public void testCheckArity() {
    table.lookup("length").get().checkArity(0);
    table.lookup("append").get().checkArity(2);
    table.lookup("appendAll").get().checkArity(7);

    ArgumentCountException e =
        Assert.expectThrows(
            ArgumentCountException.class, () -> table.lookup("length").get().checkArity(1));
    Assert.assertEquals(e.getMessage(), "wrong number of arguments (1 for 0)");
    e =
        Assert.expectThrows(
            ArgumentCountException.class, () -> table.lookup("append").get().checkArity(3));
    Assert.assertEquals(e.getMessage(), "wrong number of arguments (3 for 1..2)");
    e =
        Assert.expectThrows(
            ArgumentCountException.class, () -> table.lookup("appendAll").get().checkArity(0));
    Assert.assertEquals(e.getMessage(), "wrong number of arguments (0 for 1+)");
    Assert.assertEquals(e.given, 0);
  }

  @Test
  public void testInvalidDefinitions() {
    Assert.expectThrows(
        IllegalArgumentException.class,
        () ->
            ActorMethodTable.<Object>builder()
                .method("twice", 0, (o, args, block) -> null)
                .method("twice", 1, (o, args, block) -> null));
    Assert.expectThrows(
        IllegalArgumentException.class,
        () -> ActorMethodTable.<Object>builder().method("inverted", 2, 1, (o, a, b) -> null));
    Assert.expectThrows(
        IllegalArgumentException.class,
        () -> ActorMethodTable.<Object>builder().method("negative", -1, (o, a, b) -> null));
  }
}
