package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the IrSerializer.
 */
public final class IrSerializerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testReloadedIrResolvesToTheSameTable() throws Exception {
    // 1. prep the smart lock IR with its comment annotations
    final Diagnostics diagnostics = new Diagnostics();
    Specification original = TestSpecifications
        .build(TestSpecifications.load(TestSpecifications.smartLock), diagnostics);
    original = original.withAnnotations(new CommentHintAnnotator().annotate(original));

    // 2. write and read it back
    final IrSerializer serializer = new IrSerializer();
    final String json = serializer.toJson(original);
    assertTrue(json.contains("\"formatVersion\": 1"));
    assertTrue(json.contains("\"condition\": \"(Code == INVALID AND Attempt_Count < 3)\""));
    final Specification reloaded = serializer.fromJson(json);

    // 3. same document, same table, same hardware
    assertEquals(json, serializer.toJson(reloaded));
    final TransitionTable table = new PriorityResolver().resolve(original);
    final TransitionTable reloadedTable = new PriorityResolver().resolve(reloaded);
    assertEquals(table, reloadedTable);
    assertEquals(table.describe(), reloadedTable.describe());
    assertEquals(original.getAnnotations(), reloaded.getAnnotations());
    assertEquals(original.getHeader(), reloaded.getHeader());
    assertEquals(original.getState("IDLE_LOCKED").getPosition(),
        reloaded.getState("IDLE_LOCKED").getPosition());

    final CompilerConfiguration config =
        CompilerConfiguration.CompilerConfigurationBuilder.newBuilder().build();
    final String hdl =
        new VerilogGenerator(config).generate(original, table, new Diagnostics()).getHdl();
    final String reloadedHdl = new VerilogGenerator(config)
        .generate(reloaded, reloadedTable, new Diagnostics()).getHdl();
    assertEquals(hdl, reloadedHdl);
  }

  @Test
  public void testReloadedIrCompiles() throws Exception {
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
    final CompilationResult fromText =
        compiler.compile(TestSpecifications.load(TestSpecifications.smartLock));
    final IrSerializer serializer = new IrSerializer();
    final CompilationResult fromIr =
        compiler.compile(serializer.fromJson(serializer.toJson(fromText.getSpecification())));

    assertEquals(fromText.getWarnings().size(), fromIr.getWarnings().size());
    assertEquals(fromText.getHdl(), fromIr.getHdl());
    assertNotEquals(fromText.getCompileId(), fromIr.getCompileId());
  }

  @Test
  public void testMalformedDocuments() throws Exception {
    final IrSerializer serializer = new IrSerializer();
    final String json = serializer.toJson(TestSpecifications
        .build(TestSpecifications.load(TestSpecifications.smartLock), new Diagnostics()));

    expectFailure(serializer, null);
    expectFailure(serializer, "{");
    expectFailure(serializer, "[]");
    expectFailure(serializer, "{}");
    expectFailure(serializer, json.replace("\"formatVersion\": 1", "\"formatVersion\": 2"));
    expectFailure(serializer,
        json.replace("\"condition\": \"Code == VALID\"", "\"condition\": \"Code ==\""));
    expectFailure(serializer, json.replace("\"kind\": \"SYMBOLIC\"", "\"kind\": \"FUZZY\""));
  }

  @Test
  public void testMissingOrMistypedMembersAreNamed() throws Exception {
    final IrSerializer serializer = new IrSerializer();
    final String json = serializer.toJson(TestSpecifications
        .build(TestSpecifications.load(TestSpecifications.smartLock), new Diagnostics()));

    // 1. a required member is absent
    CompilerException failure =
        expectFailure(serializer, json.replace("\"source\": ", "\"origin\": "));
    assertEquals("Missing member 'source'", failure.getMessage());

    // 2. a required member is null
    failure = expectFailure(serializer,
        json.replace("\"destination\": \"IDLE_LOCKED\"", "\"destination\": null"));
    assertEquals("Missing member 'destination'", failure.getMessage());

    // 3. an array member holds something else
    failure = expectFailure(serializer, "{\"formatVersion\": 1, \"states\": {}}");
    assertEquals("Member 'states' must be an array", failure.getMessage());

    // 4. a list element is not an object
    failure = expectFailure(serializer, "{\"formatVersion\": 1, \"states\": [\"IDLE\"]}");
    assertEquals("Expected state to be a JSON object", failure.getMessage());
  }

  private static CompilerException expectFailure(final IrSerializer serializer,
      final String json) {
    try {
      serializer.fromJson(json);
      fail("Expected the IR document to be rejected: " + json);
    } catch (CompilerException expected) {
      assertEquals(CompilerException.Code.IR_SERIALIZATION_FAILURE, expected.getCode());
      return expected;
    }
    return null;
  }
}
