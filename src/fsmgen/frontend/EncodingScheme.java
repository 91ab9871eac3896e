package fsmgen.frontend;

import java.util.Optional;

public enum EncodingScheme {
  ONE_HOT("onehot"),
  COUNTER("counter");

  private final String serialName;

  EncodingScheme(String serialName) { this.serialName = serialName; }

  public String getSerialName() { return serialName; }

  public static Optional<EncodingScheme> fromSerialName(String name) {
    for (EncodingScheme scheme : values())
      if (scheme.serialName.equals(name))
        return Optional.of(scheme);
    return Optional.empty();
  }
}
