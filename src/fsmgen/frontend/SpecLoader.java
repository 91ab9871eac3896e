package fsmgen.frontend;

import fsmgen.ui.FsmGenConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads state machine descriptions and tool option files (YAML).
 */
public class SpecLoader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Loads a description file into its generic map/list form. */
  public static Map<String, Object> load(Path file) throws FsmSpecException {
    logger.debug("Reading {}", file);
    try (InputStream in = Files.newInputStream(file)) {
      return asDocument(new Yaml().load(in), file.toString());
    } catch (IOException e) {
      throw new ResourceException("Cannot read " + file + ": " + e.getMessage(), e);
    } catch (YAMLException e) {
      throw new StructuralInputException("Malformed YAML in " + file + ": " + e.getMessage(), e);
    }
  }

  /** Loads a description given as text; {@code origin} only appears in error messages. */
  public static Map<String, Object> load(String yamlText, String origin) throws FsmSpecException {
    try (Reader in = new StringReader(yamlText)) {
      return asDocument(new Yaml().load(in), origin);
    } catch (IOException e) {
      throw new ResourceException("Cannot read " + origin + ": " + e.getMessage(), e);
    } catch (YAMLException e) {
      throw new StructuralInputException("Malformed YAML in " + origin + ": " + e.getMessage(), e);
    }
  }

  /** Loads tool options; keys are the public fields of {@link FsmGenConfig}, missing keys keep their defaults. */
  public static FsmGenConfig loadConfig(Path file) throws FsmSpecException {
    Yaml yaml = new Yaml(new Constructor(FsmGenConfig.class, new LoaderOptions()));
    try (InputStream in = Files.newInputStream(file)) {
      FsmGenConfig cfg = yaml.load(in);
      return (cfg == null) ? new FsmGenConfig() : cfg;
    } catch (IOException e) {
      throw new ResourceException("Cannot read " + file + ": " + e.getMessage(), e);
    } catch (YAMLException e) {
      throw new StructuralInputException("Invalid tool options in " + file + ": " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asDocument(Object loaded, String origin) throws StructuralInputException {
    if (!(loaded instanceof Map))
      throw new StructuralInputException(origin + " does not contain a mapping at the top level");
    for (Object key : ((Map<?, ?>)loaded).keySet())
      if (!(key instanceof String))
        throw new StructuralInputException(origin + ": top level key " + key + " is not a string");
    return (Map<String, Object>)loaded;
  }
}
