package org.hypertrace.core.query.timeseries.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.hypertrace.core.query.timeseries.builder.WhereClauseParser.ParsedWhereClause;
import org.junit.jupiter.api.Test;

class WhereClauseParserTest {

  @Test
  void parsesQuotedAndBareValues() {
    ParsedWhereClause parsed =
        WhereClauseParser.parse(
            "Service.Name = \"checkout api\" AND severity='WARN' and deployment.environment=prod");

    assertEquals(
        List.of(
            new WhereClause("service.name", "checkout api"),
            new WhereClause("severity", "WARN"),
            new WhereClause("deployment.environment", "prod")),
        parsed.getClauses());
    assertTrue(parsed.getWarnings().isEmpty());
  }

  @Test
  void warnsOnClausesItCannotParse() {
    ParsedWhereClause parsed =
        WhereClauseParser.parse("service.name != checkout AND span.name = a b AND env = prod");

    assertEquals(List.of(new WhereClause("env", "prod")), parsed.getClauses());
    assertEquals(
        List.of(
            "Unsupported clause syntax ignored: service.name != checkout",
            "Unsupported clause syntax ignored: span.name = a b"),
        parsed.getWarnings());
  }

  @Test
  void blankExpressionHasNoClauses() {
    assertTrue(WhereClauseParser.parse("   ").getClauses().isEmpty());
    assertTrue(WhereClauseParser.parse(null).getWarnings().isEmpty());
  }

  @Test
  void keepsEmptyQuotedValues() {
    assertEquals(
        List.of(new WhereClause("service.name", "")),
        WhereClauseParser.parse("service.name = \"\"").getClauses());
  }
}
