package com.gentoro.agentops.prompt.impl;

import com.gentoro.agentops.utility.StringUtility;
import io.pebbletemplates.pebble.extension.Function;
import io.pebbletemplates.pebble.template.EvaluationContext;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.util.List;
import java.util.Map;

/** {@code {{ ident(text, 4) }}}: indents every line of {@code text}; long text is not cut. */
public class IdentFunction implements Function {

  @Override
  public List<String> getArgumentNames() {
    // null means variable arguments are allowed
    return null;
  }

  @Override
  public Object execute(
      Map<String, Object> args, PebbleTemplate self, EvaluationContext context, int lineNumber) {
    Object indent = args.get("1");
    return StringUtility.formatWithIndent(
        String.valueOf(args.get("0")),
        indent instanceof Number n ? n.intValue() : 2,
        -1);
  }
}
