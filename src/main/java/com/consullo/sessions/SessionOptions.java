package com.consullo.sessions;

import com.consullo.sessions.workspace.Workspace;
import java.nio.file.Path;

/**
 * Optional settings for a new session. Unset values fall back to the coordinator's defaults.
 *
 * <p>
 * Geometry and title are applied to the window before it is displayed.
 * </p>
 */
public final class SessionOptions {

  private static final SessionOptions DEFAULTS = builder().build();

  private final Path workingDirectory;
  private final String title;
  private final int columns;
  private final int rows;
  private final Workspace workspace;

  private SessionOptions(Builder b) {
    this.workingDirectory = b.workingDirectory;
    this.title = b.title;
    this.columns = b.columns;
    this.rows = b.rows;
    this.workspace = b.workspace;
  }

  public static SessionOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return working directory, or null for the current directory
   */
  public Path getWorkingDirectory() {
    return workingDirectory;
  }

  /**
   * @return operator title for the window, or null
   */
  public String getTitle() {
    return title;
  }

  public boolean hasGeometry() {
    return columns > 0;
  }

  public int getColumns() {
    return columns;
  }

  public int getRows() {
    return rows;
  }

  /**
   * @return workspace the window should join, or null to let the coordinator decide
   */
  public Workspace getWorkspace() {
    return workspace;
  }

  public static final class Builder {

    private Path workingDirectory;
    private String title;
    private int columns;
    private int rows;
    private Workspace workspace;

    private Builder() {
    }

    public Builder workingDirectory(Path workingDirectory) {
      this.workingDirectory = workingDirectory;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder geometry(int columns, int rows) {
      this.columns = columns;
      this.rows = rows;
      return this;
    }

    public Builder workspace(Workspace workspace) {
      this.workspace = workspace;
      return this;
    }

    public SessionOptions build() {
      if (columns < 0 || rows < 0 || (columns == 0) != (rows == 0)) {
        throw new IllegalArgumentException("columns/rows must both be positive, or both unset.");
      }
      if (title != null && title.isBlank()) {
        throw new IllegalArgumentException("title must not be blank.");
      }
      return new SessionOptions(this);
    }
  }
}
