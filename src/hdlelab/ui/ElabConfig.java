package hdlelab.ui;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold elaboration options.
 */
public class ElabConfig {

  /** Target platform identifier. Reported in diagnostics only. */
  public String platform = "";

  public boolean warn_unconstrained_array_index = true;
  /**
   * Rewrite array selections into multiplexer chains. When false, driver sources may still contain ArrayRef nodes; that table is
   * for inspection only and is not a valid input for a backend.
   */
  public boolean lower_arrays = true;
  public boolean dump_drivers = false;

  /**
   * Reads a config from a YAML mapping. Missing keys keep their defaults; unknown keys are rejected.
   * @param in the YAML document
   * @return the config, or the defaults for an empty document
   * @throws org.yaml.snakeyaml.error.YAMLException on malformed input or unknown keys
   */
  public static ElabConfig load(InputStream in) {
    Yaml yaml = new Yaml(new Constructor(ElabConfig.class, new LoaderOptions()));
    ElabConfig config = yaml.load(in);
    return config != null ? config : new ElabConfig();
  }

  public static ElabConfig load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    }
  }

  @Override
  public String toString() {
    return String.format("ElabConfig(platform=%s, warn_unconstrained_array_index=%b, lower_arrays=%b, dump_drivers=%b)", platform,
                         warn_unconstrained_array_index, lower_arrays, dump_drivers);
  }
}
