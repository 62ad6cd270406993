package io.xmliterator.reduce;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import io.xmliterator.input.XMLStreamEvent;

/**
 * Counts how often each path of element names from the root element occurs.
 * For example, <code>&lt;a&gt;&lt;b/&gt;&lt;b/&gt;&lt;/a&gt;</code> yields
 * <code>[a]: 1</code> and <code>[a, b]: 2</code>.
 * @since 1.0.0
 */
public class PathCounter implements XMLReducer<Map<List<String>, Long>> {
  private final List<String> path = new ArrayList<>();
  private final Map<List<String>, Long> counts = new LinkedHashMap<>();

  @Override
  public void onEvent(XMLStreamEvent event) {
    switch (event.getKind()) {
      case START:
        path.add(event.getValue());
        count();
        break;

      case EMPTY:
        path.add(event.getValue());
        count();
        path.remove(path.size() - 1);
        break;

      case END:
        if (!path.isEmpty()) {
          path.remove(path.size() - 1);
        }
        break;

      default:
        break;
    }
  }

  private void count() {
    counts.merge(ImmutableList.copyOf(path), 1L, Long::sum);
  }

  @Override
  public Map<List<String>, Long> getResult() {
    return ImmutableMap.copyOf(counts);
  }
}
