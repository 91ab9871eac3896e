package fsmgen.frontend;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TransitionLineParserTest {

  TransitionLineParser parser;

  @BeforeEach
  void setUp() {
    Map<String, OutputPort> outputs = new LinkedHashMap<>();
    outputs.put("busy", new OutputPort("busy", 1, false));
    outputs.put("data", new OutputPort("data", 8, true));
    parser = new TransitionLineParser(outputs);
  }

  @Test
  void testConditionalArc() throws FsmSpecException {
    TransitionClause clause = parser.parseClause("IDLE", "(go==1), RUN");
    Assertions.assertEquals(TransitionClause.Kind.CONDITIONAL, clause.getKind());
    Assertions.assertEquals(Optional.of("go==1"), clause.getCondition());
    Assertions.assertEquals(Optional.of("RUN"), clause.getDestination());
    Assertions.assertTrue(clause.getOutputs().isEmpty());
  }

  @Test
  void testConditionalArcWithMealyOutputs() throws FsmSpecException {
    TransitionClause clause = parser.parseClause("IDLE", "(a && b), RUN, <busy=1'b1; data[3:0]=4'hf>");
    Assertions.assertEquals(Optional.of("a && b"), clause.getCondition());
    Assertions.assertEquals(Map.of("busy", "1'b1", "data[3:0]", "4'hf"), clause.getOutputs());
    Assertions.assertEquals(List.of("busy", "data[3:0]"), List.copyOf(clause.getOutputs().keySet()));
  }

  @Test
  void testCommasInsideConditionDoNotSplit() throws FsmSpecException {
    TransitionClause clause = parser.parseClause("S", "({a, b} == 2'b11), T, <data={x, y}>");
    Assertions.assertEquals(Optional.of("{a, b} == 2'b11"), clause.getCondition());
    Assertions.assertEquals(Optional.of("T"), clause.getDestination());
    Assertions.assertEquals(Map.of("data", "{x, y}"), clause.getOutputs());
  }

  @Test
  void testConditionWithInnerParentheses() throws FsmSpecException {
    TransitionClause clause = parser.parseClause("S", "((a) || (b)), T");
    Assertions.assertEquals(Optional.of("(a) || (b)"), clause.getCondition());
  }

  @Test
  void testCompoundGuardIsKeptWhole() throws FsmSpecException {
    TransitionClause clause = parser.parseClause("IDLE", "(go==1) || (stop==1), RUN");
    Assertions.assertEquals(Optional.of("(go==1) || (stop==1)"), clause.getCondition());
    Assertions.assertEquals(Optional.of("RUN"), clause.getDestination());
  }

  @Test
  void testDefaultArc() throws FsmSpecException {
    TransitionClause clause = parser.parseClause("S", "  DONE ");
    Assertions.assertEquals(TransitionClause.Kind.DEFAULT, clause.getKind());
    Assertions.assertEquals(Optional.empty(), clause.getCondition());
    Assertions.assertEquals(Optional.of("DONE"), clause.getDestination());
  }

  @Test
  void testMooreDeclaration() throws FsmSpecException {
    TransitionClause clause = parser.parseClause("S", "<busy=1'b1;data[3]=x == 2;>");
    Assertions.assertEquals(TransitionClause.Kind.MOORE, clause.getKind());
    Assertions.assertEquals(Map.of("busy", "1'b1", "data[3]", "x == 2"), clause.getOutputs());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "(a), ", "a, B", "(a))|((b), B", "(a) || b, B", "(), B", "(a), <busy=1>", "(a), B, busy=1", "(a), B, <busy=1>, C", "[busy]",
                          "1STATE", "<busy>", "<=1>", "<busy=>"})
  void testMalformedClauses(String clause) {
    Assertions.assertThrows(GrammarException.class, () -> parser.parseClause("S", clause), clause);
  }

  @Test
  void testUndeclaredOutputIsReferenceError() {
    ReferenceException e = Assertions.assertThrows(ReferenceException.class, () -> parser.parseClause("S", "<ready=1>"));
    Assertions.assertTrue(e.getMessage().contains("ready"));
    Assertions.assertTrue(e.getMessage().contains("S"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"(go), T, <ready[0]=1>", "<ready[3:0]=1>"})
  void testUndeclaredIndexedOutputIsReferenceError(String clause) {
    Assertions.assertThrows(ReferenceException.class, () -> parser.parseClause("S", clause));
  }

  @ParameterizedTest
  @ValueSource(strings = {"<data[8]=1>", "<data[9:2]=0>", "<data[1:2]=0>", "<busy[1]=0>", "<data[99999999999999999999]=1>",
                          "<data[99999999999999999999:0]=1>"})
  void testIndexOutsideOfWidth(String clause) {
    Assertions.assertThrows(ReferenceException.class, () -> parser.parseClause("S", clause));
  }

  @Test
  void testSymbolicIndexIsAccepted() throws FsmSpecException {
    TransitionClause clause = parser.parseClause("S", "<data[idx]=1'b1>");
    Assertions.assertEquals(Map.of("data[idx]", "1'b1"), clause.getOutputs());
  }

  @Test
  void testSameTargetTwiceInOneList() {
    Assertions.assertThrows(GrammarException.class, () -> parser.parseClause("S", "<busy=1;busy=0>"));
  }

  @Test
  void testParseStateCollectsClauses() throws FsmSpecException {
    TransitionLineParser.ParsedState state = parser.parseState("RUN", List.of("<busy=1'b1>", "(stop), IDLE", "RUN"));
    Assertions.assertEquals("RUN", state.name);
    Assertions.assertEquals(Map.of("busy", "1'b1"), state.mooreOutputs);
    Assertions.assertEquals(2, state.transitions.size());
    Assertions.assertEquals(Optional.of("stop"), state.transitions.get(0).getCondition());
    Assertions.assertTrue(state.transitions.get(1).isDefault());
    Assertions.assertEquals("RUN", state.transitions.get(1).getDestination());
  }

  @Test
  void testSecondDefaultArcIsRejected() {
    GrammarException e = Assertions.assertThrows(GrammarException.class, () -> parser.parseState("S", List.of("A", "(go), B", "C")));
    Assertions.assertTrue(e.getMessage().contains("S"));
  }

  @Test
  void testSecondMooreClauseIsRejected() {
    Assertions.assertThrows(GrammarException.class, () -> parser.parseState("S", List.of("<busy=1>", "<data=2>")));
  }

  @Test
  void testEmptyStateIsLegal() throws FsmSpecException {
    TransitionLineParser.ParsedState state = parser.parseState("END", List.of());
    Assertions.assertTrue(state.mooreOutputs.isEmpty());
    Assertions.assertTrue(state.transitions.isEmpty());
  }
}
