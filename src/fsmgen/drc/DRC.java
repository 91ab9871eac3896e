package fsmgen.drc;

import fsmgen.frontend.EncodingConflictException;
import fsmgen.frontend.FsmSpecException;
import fsmgen.frontend.Machine;
import fsmgen.frontend.ReferenceException;
import fsmgen.frontend.StateEncoder;
import fsmgen.frontend.StructuralInputException;
import fsmgen.frontend.Transition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Design rule checks over a fully assembled machine. Run once after all states and transitions are known.
 */
public class DRC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Machine machine;

  public DRC(Machine machine) { this.machine = machine; }

  /** Runs all checks; the first violation is thrown. */
  public void CheckAll() throws FsmSpecException {
    CheckStateCount();
    CheckOutputCount();
    CheckInitialState();
    CheckDestinations();
    CheckEncodings();
    logger.debug("DRC passed for {}", machine.getName());
  }

  public void CheckStateCount() throws StructuralInputException {
    if (machine.getStates().size() < 2)
      throw new StructuralInputException("Machine " + machine.getName() + " declares " + machine.getStates().size() +
                                         " state(s), at least 2 are required");
  }

  public void CheckOutputCount() throws StructuralInputException {
    if (machine.getOutputs().isEmpty())
      throw new StructuralInputException("Machine " + machine.getName() + " declares no outputs, at least 1 is required");
  }

  public void CheckInitialState() throws ReferenceException {
    if (!machine.getStates().containsKey(machine.getInitialStateName()))
      throw new ReferenceException("Initial state " + machine.getInitialStateName() + " is not a declared state");
  }

  public void CheckDestinations() throws ReferenceException {
    for (Transition transition : machine.getTransitions())
      if (!machine.getStates().containsKey(transition.getDestination()))
        throw new ReferenceException("Transition " + transition + " of state " + transition.getSource() + " leads to undeclared state " +
                                     transition.getDestination());
  }

  public void CheckEncodings() throws EncodingConflictException { StateEncoder.checkUnique(machine.getStates()); }
}
