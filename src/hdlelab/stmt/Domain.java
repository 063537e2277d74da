package hdlelab.stmt;

import java.util.Objects;

/**
 * Driver namespace: the combinational domain or a named synchronous (clocked) domain.
 */
public final class Domain {
  public static final String COMB_NAME = "comb";
  public static final String SYNC_NAME = "sync";

  /** Combinational, stateless assignments. */
  public static final Domain COMB = new Domain(COMB_NAME);
  /** The default synchronous domain. */
  public static final Domain SYNC = new Domain(SYNC_NAME);

  private final String name;

  private Domain(String name) { this.name = name; }

  /**
   * @param name "comb" or the name of a synchronous domain
   */
  public static Domain of(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty())
      throw new IllegalArgumentException("Domain name must not be empty");
    if (name.equals(COMB_NAME))
      return COMB;
    if (name.equals(SYNC_NAME))
      return SYNC;
    return new Domain(name);
  }

  public String getName() { return name; }
  public boolean isComb() { return name.equals(COMB_NAME); }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    return name.equals(((Domain)obj).name);
  }
  @Override
  public String toString() {
    return name;
  }
}
