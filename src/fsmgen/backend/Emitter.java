package fsmgen.backend;

import fsmgen.frontend.FsmSpecException;
import fsmgen.frontend.Machine;

/**
 * Renders one artifact from a validated machine. Implementations only read the machine, so several emitters may run on the same
 * instance in any order.
 */
public interface Emitter {
  EmitterKind kind();

  /**
   * Renders the complete artifact text.
   * @throws FsmSpecException if the machine references undeclared states or outputs; no partial text is returned
   */
  String render(Machine machine) throws FsmSpecException;
}
