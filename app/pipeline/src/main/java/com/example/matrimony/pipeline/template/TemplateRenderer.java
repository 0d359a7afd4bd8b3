/*
 * Where: pipeline rendering
 * What: conditional blocks and {path} / {{path}} placeholders over nested bindings
 * Why: notification subjects and bodies are stored as templates and filled per recipient
 */
package com.example.matrimony.pipeline.template;

import com.example.matrimony.pipeline.model.NotificationTemplate;
import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Pure placeholder renderer.
 *
 * <p>A placeholder is a dotted path wrapped in single or double braces. The first path segment is
 * looked up in the bindings; following segments walk nested maps. Resolution rules:
 *
 * <ul>
 *   <li>a resolved value is rendered with {@link String#valueOf(Object)};
 *   <li>{@code null}, a missing nested key, or a path that continues past a scalar renders as the
 *       empty string;
 *   <li>a placeholder whose first segment is not bound at all is left verbatim.
 * </ul>
 *
 * <p>Before substitution, {@code {% if path OP literal %}...{% endif %}} blocks are kept or
 * dropped. {@code ==} and {@code !=} compare the rendered value as text; {@code >}, {@code >=},
 * {@code <} and {@code <=} compare numerically. An unbound path, a non-numeric operand or an
 * unknown operator drops the block. Blocks do not nest.
 *
 * <p>Rendering never throws.
 */
@Component
public class TemplateRenderer {

  static final String ELLIPSIS = "...";

  private static final String PATH = "[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*";
  // double braces are tried first so "{{a}}" is never read as "{" + "{a}" + "}"
  private static final Pattern PLACEHOLDER =
      Pattern.compile("\\{\\{\\s*(" + PATH + ")\\s*\\}\\}|\\{(" + PATH + ")\\}");
  private static final Pattern CONDITIONAL =
      Pattern.compile(
          "\\{%\\s*if\\s+(" + PATH + ")\\s*([<>=!]+)\\s*(\\w+)\\s*%\\}(.*?)\\{%\\s*endif\\s*%\\}",
          Pattern.DOTALL);

  public String render(String template, Map<String, ?> bindings) {
    if (template == null || template.isEmpty()) {
      return "";
    }
    final Map<String, ?> scope = bindings == null ? Map.of() : bindings;
    final String expanded = applyConditionals(template, scope);
    final Matcher matcher = PLACEHOLDER.matcher(expanded);
    final StringBuilder out = new StringBuilder(expanded.length());
    while (matcher.find()) {
      final String path = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
      final String replacement = resolve(path, scope);
      matcher.appendReplacement(
          out, Matcher.quoteReplacement(replacement == null ? matcher.group() : replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /** Renders subject and body; bodies are cut to the template's {@code maxLength} when set. */
  public RenderedMessage render(NotificationTemplate template, Map<String, ?> bindings) {
    final String subject = template.subject() == null ? null : render(template.subject(), bindings);
    final String body = truncate(render(template.body(), bindings), template.maxLength());
    return new RenderedMessage(subject, body);
  }

  public static String truncate(String text, Integer maxLength) {
    if (text == null || maxLength == null || maxLength <= 0 || text.length() <= maxLength) {
      return text;
    }
    if (maxLength <= ELLIPSIS.length()) {
      return text.substring(0, maxLength);
    }
    return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
  }

  private String applyConditionals(String template, Map<String, ?> bindings) {
    final Matcher matcher = CONDITIONAL.matcher(template);
    final StringBuilder out = new StringBuilder(template.length());
    while (matcher.find()) {
      final boolean keep =
          holds(lookup(matcher.group(1), bindings), matcher.group(2), matcher.group(3));
      matcher.appendReplacement(out, Matcher.quoteReplacement(keep ? matcher.group(4) : ""));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  static boolean holds(Object value, String operator, String literal) {
    if (value == null) {
      return false;
    }
    final String text = String.valueOf(value);
    if ("==".equals(operator)) {
      return text.equals(literal);
    }
    if ("!=".equals(operator)) {
      return !text.equals(literal);
    }
    final int comparison;
    try {
      comparison = new BigDecimal(text.trim()).compareTo(new BigDecimal(literal));
    } catch (NumberFormatException ex) {
      return false;
    }
    return switch (operator) {
      case ">" -> comparison > 0;
      case ">=" -> comparison >= 0;
      case "<" -> comparison < 0;
      case "<=" -> comparison <= 0;
      default -> false;
    };
  }

  /** Returns the rendered value, or {@code null} when the root segment is unbound. */
  private String resolve(String path, Map<String, ?> bindings) {
    if (!bindings.containsKey(path.split("\\.")[0])) {
      return null;
    }
    final Object value = lookup(path, bindings);
    return value == null ? "" : String.valueOf(value);
  }

  private static Object lookup(String path, Map<String, ?> bindings) {
    final String[] segments = path.split("\\.");
    Object current = bindings.get(segments[0]);
    for (int i = 1; i < segments.length && current != null; i++) {
      current = current instanceof Map<?, ?> nested ? nested.get(segments[i]) : null;
    }
    return current;
  }
}
