package fsmgen.frontend;

import java.util.Objects;

/** A declared input or output of the machine. */
public class Port {
  private final String name;
  private final int width;

  public Port(String name, int width) {
    if (width <= 0)
      throw new IllegalArgumentException("width of port " + name + " must be positive, got " + width);
    this.name = name;
    this.width = width;
  }

  public String getName() { return name; }

  public int getWidth() { return width; }

  @Override
  public int hashCode() {
    return Objects.hash(name, width);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Port other = (Port)obj;
    return name.equals(other.name) && width == other.width;
  }

  @Override
  public String toString() {
    return name + "[" + width + "]";
  }
}
