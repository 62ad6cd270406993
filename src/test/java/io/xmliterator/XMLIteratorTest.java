package io.xmliterator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;

import io.vertx.ext.unit.Async;
import io.vertx.ext.unit.TestContext;
import io.vertx.ext.unit.junit.VertxUnitRunner;
import io.xmliterator.input.EventKind;
import io.xmliterator.input.EventNormalizer;
import io.xmliterator.input.XMLStreamEvent;
import io.xmliterator.node.Node;
import io.xmliterator.reduce.Edge;
import io.xmliterator.reduce.ReductionResult;

/**
 * Test {@link XMLIterator}
 */
@RunWith(VertxUnitRunner.class)
public class XMLIteratorTest {
  /**
   * A temporary folder for test files
   */
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File items(int count) throws IOException {
    StringBuilder sb = new StringBuilder("<?xml version=\"1.0\"?>\n<root>");
    for (int i = 0; i < count; ++i) {
      sb.append("<item>").append(i).append("</item>");
    }
    sb.append("</root>");
    File f = folder.newFile();
    FileUtils.writeStringToFile(f, sb.toString(), StandardCharsets.UTF_8);
    return f;
  }

  /**
   * Observe all events of a file and compare them to the iterator
   * @param context the test context
   * @throws Exception if an error has occurred
   */
  @Test
  public void observeAll(TestContext context) throws Exception {
    File f = items(10);
    List<XMLStreamEvent> expected = new ArrayList<>();
    try (EventNormalizer events = XMLIterator.iterate(f.toPath())) {
      events.forEachRemaining(expected::add);
    }
    context.assertEquals(32, expected.size());

    List<XMLStreamEvent> observed = new ArrayList<>();
    Async async = context.async();
    XMLIterator.observe(f.toPath()).subscribe(observed::add, context::fail, () -> {
      context.assertEquals(expected, observed);
      async.complete();
    });
  }

  /**
   * Take only the first events of a large file
   * @param context the test context
   * @throws Exception if an error has occurred
   */
  @Test
  public void observeTake(TestContext context) throws Exception {
    File f = items(10000);
    Async async = context.async();
    XMLIterator.observe(f.toPath())
      .take(4)
      .toList()
      .subscribe(l -> {
        context.assertEquals(4, l.size());
        context.assertEquals(new XMLStreamEvent(0, EventKind.START, "root", -1), l.get(0));
        context.assertEquals(new XMLStreamEvent(3, EventKind.END, "item", -1), l.get(3));
        async.complete();
      }, context::fail);
  }

  /**
   * Observing a malformed file emits the events before the failure
   * @param context the test context
   * @throws Exception if an error has occurred
   */
  @Test
  public void observeMalformed(TestContext context) throws Exception {
    File f = folder.newFile();
    FileUtils.writeStringToFile(f, "<a><b></a>", StandardCharsets.UTF_8);
    List<XMLStreamEvent> observed = new ArrayList<>();
    Async async = context.async();
    XMLIterator.observe(f.toPath()).subscribe(observed::add, err -> {
      context.assertTrue(err instanceof MalformedXMLException);
      context.assertEquals(2, observed.size());
      async.complete();
    }, () -> context.fail("Malformed document should not complete"));
  }

  /**
   * Observing a missing file fails
   * @param context the test context
   */
  @Test
  public void observeMissing(TestContext context) {
    Async async = context.async();
    XMLIterator.observe(new File(folder.getRoot(), "missing.xml").toPath())
      .subscribe(e -> context.fail("No event expected"), err -> {
        context.assertTrue(err.getCause() instanceof NoSuchFileException);
        async.complete();
      });
  }

  /**
   * Reducing a missing file fails immediately
   * @throws Exception if an error has occurred
   */
  @Test(expected = NoSuchFileException.class)
  public void toMappingMissing() throws Exception {
    XMLIterator.toMapping(new File(folder.getRoot(), "missing.xml").toPath());
  }

  /**
   * Convert a file to a mapping
   * @throws Exception if an error has occurred
   */
  @Test
  public void toMapping() throws Exception {
    ReductionResult<Node> r = XMLIterator.toMapping(items(3).toPath());
    assertTrue(r.isComplete());
    assertEquals("{\"root\":{\"item\":[\"0\",\"1\",\"2\"]}}", r.getValue().toJson());
  }

  /**
   * Limiting the number of events reduces the edge counts
   * @throws Exception if an error has occurred
   */
  @Test
  public void countEdgesLimited() throws Exception {
    File f = items(100);
    ReductionResult<Map<Edge, Long>> limited = XMLIterator.countEdges(f.toPath(),
        new ParserOptions().setMaxEvents(50));
    ReductionResult<Map<Edge, Long>> unlimited = XMLIterator.countEdges(f.toPath());
    long limitedTotal = limited.getValue().values().stream().mapToLong(Long::longValue).sum();
    long unlimitedTotal = unlimited.getValue().values().stream().mapToLong(Long::longValue).sum();
    assertTrue(limitedTotal < unlimitedTotal);
    assertEquals(100, unlimitedTotal);
    assertTrue(limited.isLimitReached());
    assertTrue(unlimited.isComplete());
  }

  /**
   * Count element paths of a file
   * @throws Exception if an error has occurred
   */
  @Test
  public void countPaths() throws Exception {
    Map<List<String>, Long> counts = XMLIterator.countPaths(items(5).toPath()).getValue();
    assertEquals(2, counts.size());
    assertEquals(Long.valueOf(5), counts.get(Arrays.asList("root", "item")));
  }
}
