package FSA.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A row whose symbols are grouped by shared target, e.g. {@code "0,2,4" -> S0}.
 * Handed to renderers; not a valid definition row.
 */
public record CompactedRow(Map<String, Target> arrows, boolean start, boolean accept) {

  public CompactedRow {
    arrows = Collections.unmodifiableMap(new LinkedHashMap<>(arrows));
  }

  @Override
  public String toString() {
    return arrows + ", start: " + start + ", accept: " + accept;
  }
}
