package ca.gc.cra.balancer.domain.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FlowAssignerTest {

  @Test
  void partiallyConsumedInputKeepsFeedingNextOutput() {
    AssignmentMatrix matrix = FlowAssigner.assign(List.of(5, 10), List.of(7, 8));

    assertEquals(Map.of(0, 5), matrix.row(0));
    assertEquals(List.of(0, 1), List.copyOf(matrix.row(1).keySet()));
    assertEquals(2, matrix.amount(1, 0));
    assertEquals(8, matrix.amount(1, 1));
    assertEquals(0, matrix.amount(0, 1));
    assertEquals(3, matrix.entryCount());
  }

  @Test
  void rowAndColumnTotalsMatchMagnitudes() {
    List<Integer> inputs = List.of(480, 480, 480);
    List<Integer> outputs = List.of(45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45,
        45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45, 45);

    AssignmentMatrix matrix = FlowAssigner.assign(inputs, outputs);

    for (int i = 0; i < inputs.size(); i++) {
      assertEquals(inputs.get(i).longValue(), matrix.rowTotal(i), "row " + i);
    }
    for (int j = 0; j < outputs.size(); j++) {
      assertEquals(outputs.get(j).longValue(), matrix.columnTotal(j), "column " + j);
    }
    assertTrue(matrix.entryCount() <= inputs.size() + outputs.size() - 1);
    // 480 = 10 * 45 + 30, so output 10 straddles inputs 0 and 1.
    assertEquals(Map.of(0, 30, 1, 15), matrix.column(10));
  }

  @Test
  void zeroMagnitudesProduceNoEntries() {
    AssignmentMatrix matrix = FlowAssigner.assign(List.of(0, 10, 0), List.of(10, 0));

    assertTrue(matrix.row(0).isEmpty());
    assertEquals(Map.of(0, 10), matrix.row(1));
    assertTrue(matrix.row(2).isEmpty());
    assertTrue(matrix.column(1).isEmpty());
    assertEquals(3, matrix.inputCount());
    assertEquals(2, matrix.outputCount());
  }

  @Test
  void emptySpecificationYieldsEmptyMatrix() {
    AssignmentMatrix matrix = FlowAssigner.assign(List.of(), List.of());

    assertEquals(0, matrix.inputCount());
    assertEquals(0, matrix.entryCount());
  }

  @Test
  void exhaustedInputsSignalInternalDefect() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> FlowAssigner.assign(List.of(5), List.of(10)));
    assertTrue(ex.getMessage().contains("inputs exhausted"));
  }

  @Test
  void matrixIsImmutable() {
    AssignmentMatrix matrix = FlowAssigner.assign(List.of(10), List.of(10));

    assertThrows(UnsupportedOperationException.class, () -> matrix.row(0).put(0, 1));
  }
}
