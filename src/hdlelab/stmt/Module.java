package hdlelab.stmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named unit of statements with ordered submodules. Bits driven by one module must not be driven by another.
 */
public class Module {
  private final String name;
  private final Block body = new Block();
  private final List<Module> submodules = new ArrayList<>();

  public Module(String name) { this.name = Objects.requireNonNull(name, "name"); }

  public String getName() { return name; }

  /** The construction context of the module's top-level body. */
  public Block body() { return body; }

  public Module addSubmodule(Module submodule) {
    if (submodule == this)
      throw new IllegalArgumentException("A module cannot contain itself");
    submodules.add(Objects.requireNonNull(submodule, "submodule"));
    return this;
  }

  public List<Module> getSubmodules() { return Collections.unmodifiableList(submodules); }

  /** The module's top-level statements. */
  public List<Statement> getStatements() { return body.build(); }

  @Override
  public String toString() {
    return name;
  }
}
