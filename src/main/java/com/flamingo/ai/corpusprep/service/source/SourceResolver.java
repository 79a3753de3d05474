package com.flamingo.ai.corpusprep.service.source;

import com.flamingo.ai.corpusprep.exception.UnsupportedFormatException;
import com.flamingo.ai.corpusprep.service.model.SkipReason;
import com.flamingo.ai.corpusprep.service.model.SkippedSource;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies command-line inputs and decides how each source is read.
 *
 * <ul>
 *   <li>{@code http://} and {@code https://} inputs are remote sources
 *   <li>directories are walked recursively, skipping hidden files and directories, in
 *       lexicographic order of their relative paths so that runs are reproducible; an entry that
 *       cannot be read is reported on its own and the walk continues
 *   <li>anything else is a single file, resolved even when it does not exist so that the failure
 *       is reported for that source alone
 * </ul>
 */
@Service
@Slf4j
public class SourceResolver {

  /**
   * Resolves one input into the sources it denotes.
   *
   * @param input directory, file path or URL
   * @return sources in processing order, and the directory entries that could not be read
   * @throws UncheckedIOException if the directory walk fails as a whole
   */
  public ResolvedInput resolve(String input) {
    if (isUrl(input)) {
      return ResolvedInput.of(SourceRef.url(input.trim()));
    }
    Path path = Path.of(input);
    if (Files.isDirectory(path)) {
      return walk(path);
    }
    Path fileName = path.getFileName();
    return ResolvedInput.of(SourceRef.file(fileName != null ? fileName.toString() : input, path));
  }

  /**
   * Returns the format of a local source, chosen by file extension.
   *
   * @throws UnsupportedFormatException if no format handles the extension
   */
  public SourceFormat formatOf(SourceRef source) {
    return SourceFormat.fromFileName(source.path().getFileName().toString())
        .orElseThrow(
            () ->
                new UnsupportedFormatException(
                    source.sourceId(), "Unsupported file type: " + source.sourceId()));
  }

  /**
   * Returns the format of a fetched resource: by {@code Content-Type}, then by the extension of
   * the URL path, and HTML when neither is conclusive.
   */
  public SourceFormat formatOf(FetchedResource resource) {
    return SourceFormat.fromContentType(resource.contentType())
        .or(() -> SourceFormat.fromFileName(urlPath(resource.url())))
        .orElse(SourceFormat.HTML);
  }

  /** Title used when the content of a source carries none. */
  public String fallbackTitle(SourceRef source) {
    if (source.isRemote()) {
      String host = hostOf(source.url());
      return host != null ? host : source.url();
    }
    String name = source.path().getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  public static boolean isUrl(String input) {
    String lower = input.trim().toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }

  // ---- private helpers ----

  private ResolvedInput walk(Path root) {
    log.debug("Walking directory {}", root);
    DirectoryVisitor visitor = new DirectoryVisitor(root);
    try {
      Files.walkFileTree(root, visitor);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot walk directory " + root, e);
    }
    return visitor.result();
  }

  private static String relativeId(Path root, Path file) {
    return root.relativize(file).toString().replace('\\', '/');
  }

  /** Collects the visible regular files under a root; unreadable entries become skips. */
  static final class DirectoryVisitor extends SimpleFileVisitor<Path> {

    private final Path root;
    private final List<SourceRef> sources = new ArrayList<>();
    private final List<SkippedSource> skipped = new ArrayList<>();

    DirectoryVisitor(Path root) {
      this.root = root;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
      if (!dir.equals(root) && isHidden(dir)) {
        return FileVisitResult.SKIP_SUBTREE;
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      if (!isHidden(file) && Files.isRegularFile(file)) {
        sources.add(SourceRef.file(relativeId(root, file), file));
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) {
      String id = file.equals(root) ? root.toString() : relativeId(root, file);
      log.warn("Skipping {}: cannot read ({})", id, exc.toString());
      skipped.add(new SkippedSource(id, SkipReason.UNREADABLE, "Cannot read: " + exc));
      return FileVisitResult.CONTINUE;
    }

    ResolvedInput result() {
      List<SourceRef> ordered = new ArrayList<>(sources);
      ordered.sort(Comparator.comparing(SourceRef::sourceId));
      return new ResolvedInput(ordered, skipped);
    }

    private static boolean isHidden(Path path) {
      Path name = path.getFileName();
      return name != null && name.toString().startsWith(".");
    }
  }

  /** Host of a URL, or {@code null} when it has none or cannot be parsed. */
  public static String hostOf(String url) {
    try {
      return URI.create(url).getHost();
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String urlPath(String url) {
    try {
      String path = URI.create(url).getPath();
      return path != null ? path : "";
    } catch (IllegalArgumentException e) {
      return "";
    }
  }
}
