package bio.terra.pouch.models;

import java.nio.file.Path;
import java.util.Comparator;

public record FileUsage(Path path, int priority) {

  public static final Comparator<FileUsage> RENDER_ORDER =
      Comparator.comparingInt(FileUsage::priority).thenComparing(FileUsage::path);
}
