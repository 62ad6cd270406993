package io.xmliterator.reduce;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import io.xmliterator.ParserOptions;
import io.xmliterator.input.EventNormalizer;
import io.xmliterator.input.XMLTokenizer;

/**
 * Test {@link PathCounter}
 */
public class PathCounterTest {
  private static final String CATALOG = "<?xml version=\"1.0\"?>\n"
      + "<catalog>\n"
      + "    <book id=\"1\">\n"
      + "        <title>XML Guide</title>\n"
      + "        <author>John Doe</author>\n"
      + "        <chapter num=\"1\">\n"
      + "            <title>Introduction</title>\n"
      + "            <section>\n"
      + "                <title>Overview</title>\n"
      + "            </section>\n"
      + "        </chapter>\n"
      + "    </book>\n"
      + "    <book id=\"2\">\n"
      + "        <title>Advanced XML</title>\n"
      + "        <author>Jane Smith</author>\n"
      + "    </book>\n"
      + "</catalog>";

  private static Map<List<String>, Long> count(String xml) throws IOException {
    try (EventNormalizer events = new EventNormalizer(new XMLTokenizer(
        new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)),
        new ParserOptions()))) {
      return Reductions.reduce(events, new PathCounter()).getValue();
    }
  }

  /**
   * Count the paths of a small catalog
   * @throws Exception if an error has occurred
   */
  @Test
  public void catalog() throws Exception {
    Map<List<String>, Long> counts = count(CATALOG);
    assertEquals(Long.valueOf(1), counts.get(Arrays.asList("catalog")));
    assertEquals(Long.valueOf(2), counts.get(Arrays.asList("catalog", "book")));
    assertEquals(Long.valueOf(2), counts.get(Arrays.asList("catalog", "book", "title")));
    assertEquals(Long.valueOf(2), counts.get(Arrays.asList("catalog", "book", "author")));
    assertEquals(Long.valueOf(1), counts.get(
        Arrays.asList("catalog", "book", "chapter", "title")));
    assertEquals(Long.valueOf(1), counts.get(
        Arrays.asList("catalog", "book", "chapter", "section", "title")));
    assertEquals(8, counts.size());
  }

  /**
   * Self-closing elements are counted but do not extend the path
   * @throws Exception if an error has occurred
   */
  @Test
  public void emptyElements() throws Exception {
    Map<List<String>, Long> counts = count("<a><b/><b/><c><b/></c></a>");
    assertEquals(Long.valueOf(2), counts.get(Arrays.asList("a", "b")));
    assertEquals(Long.valueOf(1), counts.get(Arrays.asList("a", "c", "b")));
    assertEquals(4, counts.size());
  }
}
