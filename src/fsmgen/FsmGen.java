package fsmgen;

import fsmgen.backend.Emitter;
import fsmgen.backend.EmitterKind;
import fsmgen.frontend.FsmSpecException;
import fsmgen.frontend.Machine;
import fsmgen.frontend.MachineBuilder;
import fsmgen.frontend.SpecLoader;
import fsmgen.ui.FsmGenConfig;
import fsmgen.util.FileWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs one generation: load the description, build the machine, render every requested artifact, then write them all.
 * Nothing is written unless every artifact rendered successfully.
 */
public class FsmGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final FsmGenConfig cfg;
  /** Requested artifacts and where they go, in request order. */
  private final LinkedHashMap<EmitterKind, Path> outputs = new LinkedHashMap<>();

  public FsmGen(FsmGenConfig cfg) { this.cfg = cfg; }

  public FsmGen() { this(new FsmGenConfig()); }

  /** Requests an artifact. Only one testbench kind can be requested per run. */
  public FsmGen AddOutput(EmitterKind kind, Path file) {
    if (kind.isTestbench() && outputs.keySet().stream().anyMatch(other -> other.isTestbench() && other != kind))
      throw new IllegalArgumentException("only one testbench kind can be generated per run");
    outputs.put(kind, file);
    return this;
  }

  public Map<EmitterKind, Path> GetOutputs() { return outputs; }

  public Machine Build(Path input) throws FsmSpecException { return new MachineBuilder(cfg).build(SpecLoader.load(input)); }

  /** Renders every requested artifact into a {@link FileWriter} without touching the file system. */
  public FileWriter Render(Machine machine) throws FsmSpecException {
    FileWriter toFile = new FileWriter();
    for (Map.Entry<EmitterKind, Path> output : outputs.entrySet()) {
      Emitter emitter = output.getKey().create(cfg);
      logger.info("Generating {} for {}", output.getKey().getSerialName(), machine.getName());
      toFile.UpdateContent(output.getValue(), emitter.render(machine));
    }
    return toFile;
  }

  public void Generate(Path input) throws FsmSpecException {
    if (outputs.isEmpty())
      throw new IllegalStateException("no output requested");
    Machine machine = Build(input);
    Render(machine).WriteFiles();
  }
}
