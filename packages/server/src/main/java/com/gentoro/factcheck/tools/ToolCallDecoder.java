package com.gentoro.factcheck.tools;

import com.gentoro.factcheck.exception.UnresolvedFunctionException;
import com.gentoro.factcheck.exception.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Validates raw function-call arguments and decodes them into {@link ToolCall} variants. */
public class ToolCallDecoder {
  static final String CLAIMS_ARGUMENT = "identified_claims";
  static final String INSTANCES_ARGUMENT = "identified_instances";
  static final String CLAIM_FIELD = "claim";

  public ToolKind resolve(String functionName) {
    return ToolKind.fromFunctionName(functionName)
        .orElseThrow(() -> new UnresolvedFunctionException(functionName));
  }

  /**
   * @throws UnresolvedFunctionException for names outside {@link ToolKind}
   * @throws ValidationException when the arguments do not have the expected shape
   */
  public ToolCall decode(String functionName, Map<String, Object> args) {
    ToolKind kind = resolve(functionName);
    return switch (kind) {
      case MEDICAL_CLAIMS_IDENTIFICATION -> decodeClaims(args);
      case IMPRECISE_LANGUAGE_IDENTIFICATION -> decodeImpreciseLanguage(args);
    };
  }

  public ToolCall.ClaimsIdentification decodeClaims(Map<String, Object> args) {
    List<IdentifiedClaim> claims = new ArrayList<>();
    for (Map<String, Object> entry : objectList(args, CLAIMS_ARGUMENT)) {
      Object claim = entry.get(CLAIM_FIELD);
      if (!(claim instanceof String text) || text.isBlank()) {
        throw new ValidationException(
            "Each entry of `" + CLAIMS_ARGUMENT + "` needs a non-empty `" + CLAIM_FIELD + "`");
      }
      claims.add(new IdentifiedClaim(text, entry));
    }
    return new ToolCall.ClaimsIdentification(claims);
  }

  public ToolCall.ImpreciseLanguage decodeImpreciseLanguage(Map<String, Object> args) {
    return new ToolCall.ImpreciseLanguage(objectList(args, INSTANCES_ARGUMENT));
  }

  private static List<Map<String, Object>> objectList(Map<String, Object> args, String name) {
    Object raw = args == null ? null : args.get(name);
    if (raw == null) return List.of();
    if (!(raw instanceof List<?> list)) {
      throw new ValidationException("Argument `" + name + "` must be an array");
    }
    List<Map<String, Object>> result = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof Map<?, ?> map)) {
        throw new ValidationException("Entries of `" + name + "` must be objects");
      }
      Map<String, Object> copy = new LinkedHashMap<>();
      map.forEach((k, v) -> copy.put(String.valueOf(k), v));
      result.add(copy);
    }
    return result;
  }
}
