package bio.terra.pouch.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime record of one resolved secret: its latest data, when it has to be resolved again and
 * which files were rendered from it.
 */
public class SecretState {

  private String name;
  private Map<String, Object> data = new HashMap<>();
  @Nullable private String leaseId;
  private Duration leaseDuration = Duration.ZERO;
  private Instant resolvedAt;
  @Nullable private Instant renewAt;
  private List<FileUsage> filesUsing = new ArrayList<>();

  // for jackson
  SecretState() {}

  public SecretState(String name) {
    this.name = name;
  }

  /**
   * Replace data and lease information with a fresh result. Usage entries are kept, they are
   * needed to know which files to render again.
   */
  public void update(SecretResult result, Instant resolvedAt, @Nullable Instant renewAt) {
    this.data = new HashMap<>(result.getData());
    this.leaseId = result.getLeaseId().orElse(null);
    this.leaseDuration = result.getLeaseDuration();
    this.resolvedAt = resolvedAt;
    this.renewAt = renewAt;
  }

  /** Record that a file uses this secret. At most one entry is kept per path. */
  public void registerUsage(Path path, int priority) {
    filesUsing.removeIf(usage -> usage.path().equals(path));
    filesUsing.add(new FileUsage(path, priority));
    filesUsing.sort(FileUsage.RENDER_ORDER);
  }

  public boolean removeUsage(Path path) {
    return filesUsing.removeIf(usage -> usage.path().equals(path));
  }

  public void clearUsages() {
    filesUsing.clear();
  }

  @JsonIgnore
  public Optional<Instant> getNextRenewal() {
    return Optional.ofNullable(renewAt);
  }

  @JsonIgnore
  public boolean isDue(Instant now) {
    return renewAt != null && !renewAt.isAfter(now);
  }

  public String getName() {
    return name;
  }

  public Map<String, Object> getData() {
    return data;
  }

  @Nullable
  public String getLeaseId() {
    return leaseId;
  }

  public Duration getLeaseDuration() {
    return leaseDuration;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }

  @Nullable
  public Instant getRenewAt() {
    return renewAt;
  }

  public List<FileUsage> getFilesUsing() {
    return filesUsing;
  }

  void setName(String name) {
    this.name = name;
  }

  void setData(Map<String, Object> data) {
    this.data = data == null ? new HashMap<>() : new HashMap<>(data);
  }

  void setLeaseId(@Nullable String leaseId) {
    this.leaseId = leaseId;
  }

  void setLeaseDuration(Duration leaseDuration) {
    this.leaseDuration = leaseDuration == null ? Duration.ZERO : leaseDuration;
  }

  void setResolvedAt(Instant resolvedAt) {
    this.resolvedAt = resolvedAt;
  }

  void setRenewAt(@Nullable Instant renewAt) {
    this.renewAt = renewAt;
  }

  void setFilesUsing(List<FileUsage> filesUsing) {
    this.filesUsing = filesUsing == null ? new ArrayList<>() : new ArrayList<>(filesUsing);
    this.filesUsing.sort(FileUsage.RENDER_ORDER);
  }
}
