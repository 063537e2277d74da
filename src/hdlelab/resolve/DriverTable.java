package hdlelab.resolve;

import hdlelab.stmt.Domain;
import hdlelab.value.Signal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Output of elaboration: the drivers of every domain, in deterministic order. Immutable.
 */
public final class DriverTable {
  private final Map<Domain, List<Driver>> byDomain = new LinkedHashMap<>();

  public DriverTable(List<Driver> drivers) {
    for (Driver driver : drivers)
      byDomain.computeIfAbsent(driver.getDomain(), domain -> new ArrayList<>()).add(driver);
    byDomain.replaceAll((domain, list) -> Collections.unmodifiableList(list));
  }

  /** Domains that have at least one driver, in order of first appearance. */
  public Set<Domain> domains() { return Collections.unmodifiableSet(byDomain.keySet()); }

  public List<Driver> drivers(Domain domain) { return byDomain.getOrDefault(domain, List.of()); }

  public List<Driver> all() { return byDomain.values().stream().flatMap(List::stream).collect(Collectors.toList()); }

  /** All drivers of a signal, over all domains. */
  public List<Driver> driversOf(Signal signal) {
    return byDomain.values().stream().flatMap(List::stream).filter(driver -> driver.getTarget() == signal).collect(Collectors.toList());
  }

  public int size() { return byDomain.values().stream().mapToInt(List::size).sum(); }
  public boolean isEmpty() { return size() == 0; }

  @Override
  public String toString() {
    return all().stream().map(Driver::toString).collect(Collectors.joining("\n"));
  }
}
