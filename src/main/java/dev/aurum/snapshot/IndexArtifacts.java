package dev.aurum.snapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Which index types exist under a repository's {@code .code-indexer} directory.
 *
 * @param semantic vector collections under {@code index/} (other than the temporal one)
 * @param fts full-text index under {@code tantivy_index/}
 * @param temporal commit-history collection under {@code index/code-indexer-temporal/}
 * @param scip at least one {@code *.scip.db} file under {@code scip/}
 */
public record IndexArtifacts(boolean semantic, boolean fts, boolean temporal, boolean scip) {

  public static final String CODE_INDEXER_DIR = ".code-indexer";
  public static final String INDEX_DIR = "index";
  static final String TEMPORAL_COLLECTION = "code-indexer-temporal";
  static final String FTS_DIR = "tantivy_index";
  static final String SCIP_DIR = "scip";

  /** Inspects {@code repoPath} without modifying it. */
  public static IndexArtifacts detect(Path repoPath) {
    Path codeIndexer = repoPath.resolve(CODE_INDEXER_DIR);
    Path index = codeIndexer.resolve(INDEX_DIR);
    boolean semantic =
        listDirectory(index).stream()
            .filter(Files::isDirectory)
            .anyMatch(p -> !p.getFileName().toString().equals(TEMPORAL_COLLECTION));
    boolean fts = Files.isDirectory(codeIndexer.resolve(FTS_DIR));
    boolean temporal = Files.isDirectory(index.resolve(TEMPORAL_COLLECTION));
    boolean scip =
        listDirectory(codeIndexer.resolve(SCIP_DIR)).stream()
            .anyMatch(p -> p.getFileName().toString().endsWith(".scip.db"));
    return new IndexArtifacts(semantic, fts, temporal, scip);
  }

  public boolean any() {
    return semantic || fts || temporal || scip;
  }

  /** Names of the present index types, for log messages. */
  public List<String> present() {
    List<String> names = new ArrayList<>();
    if (semantic) {
      names.add("semantic");
    }
    if (fts) {
      names.add("fts");
    }
    if (temporal) {
      names.add("temporal");
    }
    if (scip) {
      names.add("scip");
    }
    return names;
  }

  private static List<Path> listDirectory(Path dir) {
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    List<Path> entries = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
      stream.forEach(entries::add);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }
    return entries;
  }
}
