package com.gentoro.factcheck.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.factcheck.exception.ExceptionUtil;
import com.gentoro.factcheck.exception.ToolExecutionException;
import com.gentoro.factcheck.exception.UnresolvedFunctionException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConversationResultTest {

  @Test
  void displayTextAppendsOnlyToolFailures() {
    ConversationResult result =
        new ConversationResult(
            "Here is what I found.",
            "c-1",
            null,
            null,
            List.of(
                ExceptionUtil.toErrorDetails(new UnresolvedFunctionException("lookup")),
                ExceptionUtil.toErrorDetails(
                    new ToolExecutionException(
                        "medical_claims_identification",
                        "Error when Identifying Medical Claims: bad args",
                        null))),
            1);

    assertEquals(
        "Here is what I found.\nError when Identifying Medical Claims: bad args",
        result.displayText());
  }

  @Test
  void missingOutputRendersAsEmpty() {
    assertEquals("", new ConversationResult(null, "c-1", null, null, List.of(), 0).displayText());
  }
}
