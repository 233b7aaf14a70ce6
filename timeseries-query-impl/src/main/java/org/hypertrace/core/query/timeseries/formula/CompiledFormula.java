package org.hypertrace.core.query.timeseries.formula;

import java.util.List;
import lombok.Value;

/** Postfix plan of a formula and the distinct identifiers it references, in first-seen order. */
@Value
public class CompiledFormula {
  List<FormulaToken> postfix;
  List<String> identifiers;
}
