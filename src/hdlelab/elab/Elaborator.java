package hdlelab.elab;

import hdlelab.control.ControlFlowCompiler;
import hdlelab.pattern.PatternMatcher;
import hdlelab.resolve.ArrayLowering;
import hdlelab.resolve.AssignmentResolver;
import hdlelab.resolve.Driver;
import hdlelab.resolve.DriverTable;
import hdlelab.stmt.Domain;
import hdlelab.stmt.Module;
import hdlelab.stmt.Statement;
import hdlelab.stmt.SwitchStatement;
import hdlelab.ui.ElabConfig;
import hdlelab.value.ArrayRef;
import hdlelab.value.Signal;
import hdlelab.value.Value;
import hdlelab.value.Values;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One-shot pass from a module hierarchy to a validated driver table.
 *
 * <ol>
 * <li>INFERRING: every value reachable from any statement gets its shape; constant array indices and switch patterns are checked.</li>
 * <li>RESOLVING: each module body is compiled into drivers, array selections are lowered to multiplexers, and the drivers of all
 * modules are merged.</li>
 * <li>VALIDATED: the merged table is checked for duplicate drivers and width consistency.</li>
 * </ol>
 * On the first error the elaborator enters FAILED and produces no output. Host errors (a hierarchy cycle, an internal check) also
 * end in FAILED, without an {@link ElaborationException} in {@link #getError()}.
 */
public class Elaborator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ElabConfig config;
  private ElaborationState state = ElaborationState.BUILDING;
  private ElaborationException error = null;

  public Elaborator(ElabConfig config) { this.config = config; }
  public Elaborator() { this(new ElabConfig()); }

  public ElaborationState getState() { return state; }
  public ElabConfig getConfig() { return config; }
  /** The fatal diagnostic, present only in state FAILED. */
  public Optional<ElaborationException> getError() { return Optional.ofNullable(error); }

  /**
   * Elaborates a module and all its submodules.
   * @param top the root of the hierarchy
   * @return the drivers of all modules
   * @throws ElaborationException on the first shape, pattern, index or driver conflict
   * @throws IllegalStateException if this elaborator has already run
   */
  public DriverTable elaborate(Module top) {
    if (state != ElaborationState.BUILDING)
      throw new IllegalStateException("Elaborator has already run, state is " + state);
    logger.debug("Elaborating {} for platform '{}'", top.getName(), config.platform);
    try {
      Map<String, List<Statement>> modules = flattenHierarchy(top);

      enter(ElaborationState.INFERRING);
      int nodes = infer(modules);
      logger.debug("Inferred shapes of {} node(s) in {} module(s)", nodes, modules.size());

      enter(ElaborationState.RESOLVING);
      List<Driver> drivers = resolve(modules);

      DriverTable table = validate(drivers);
      enter(ElaborationState.VALIDATED);
      if (config.dump_drivers)
        table.all().forEach(driver -> logger.trace("{} [{}]", driver, driver.getModule()));
      logger.debug("Elaboration of {} produced {} driver(s)", top.getName(), table.size());
      return table;
    } catch (ElaborationException e) {
      error = e;
      state = ElaborationState.FAILED;
      logger.error("Elaboration of {} failed: {}", top.getName(), e.getMessage());
      throw e;
    } catch (RuntimeException | Error e) {
      state = ElaborationState.FAILED;
      logger.error("Elaboration of {} aborted by {}", top.getName(), e.toString());
      throw e;
    }
  }

  private void enter(ElaborationState next) {
    logger.debug("Elaborator: {} -> {}", state, next);
    state = next;
  }

  /** Hierarchical module names (top.sub.subsub) to their statements, parents before children. */
  private static Map<String, List<Statement>> flattenHierarchy(Module top) {
    Map<String, List<Statement>> result = new LinkedHashMap<>();
    Set<Module> ancestors = Collections.newSetFromMap(new IdentityHashMap<>());
    flattenHierarchy(top, top.getName(), ancestors, result);
    return result;
  }

  private static void flattenHierarchy(Module module, String path, Set<Module> ancestors, Map<String, List<Statement>> out) {
    if (!ancestors.add(module))
      throw new IllegalArgumentException("Module hierarchy contains a cycle through " + path);
    String uniquePath = path;
    for (int i = 1; out.containsKey(uniquePath); ++i)
      uniquePath = path + "$" + i;
    out.put(uniquePath, module.getStatements());
    for (Module submodule : module.getSubmodules())
      flattenHierarchy(submodule, uniquePath + "." + submodule.getName(), ancestors, out);
    ancestors.remove(module);
  }

  private static int infer(Map<String, List<Statement>> modules) {
    List<Value> roots = new ArrayList<>();
    for (List<Statement> statements : modules.values())
      collectValues(statements, roots);
    List<Value> nodes = Values.postOrder(roots);
    for (Value node : nodes) {
      node.shape();
      if (node instanceof ArrayRef)
        ArrayLowering.checkConstantIndex((ArrayRef)node);
    }
    return nodes.size();
  }

  private static void collectValues(List<Statement> statements, List<Value> out) {
    for (Statement statement : statements) {
      out.addAll(statement.values());
      if (statement instanceof SwitchStatement) {
        SwitchStatement switchStatement = (SwitchStatement)statement;
        for (SwitchStatement.Case c : switchStatement.getCases())
          PatternMatcher.validateAll(c.patterns(), switchStatement.getSubject().shape(), statement);
      }
      for (List<Statement> body : statement.bodies())
        collectValues(body, out);
    }
  }

  private List<Driver> resolve(Map<String, List<Statement>> modules) {
    AssignmentResolver resolver = new AssignmentResolver(new ControlFlowCompiler());
    ArrayLowering lowering = new ArrayLowering(config.warn_unconstrained_array_index);
    List<Driver> drivers = new ArrayList<>();
    for (Map.Entry<String, List<Statement>> module : modules.entrySet()) {
      for (Driver driver : resolver.resolve(module.getValue(), module.getKey()))
        drivers.add(config.lower_arrays ? lowering.lower(driver) : driver);
    }
    return drivers;
  }

  private DriverTable validate(List<Driver> drivers) {
    Map<Signal, Domain> domainOf = new HashMap<>();
    Map<Signal, Driver[]> ownerOfBit = new HashMap<>();
    List<Value> sources = new ArrayList<>();
    for (Driver driver : drivers) {
      Signal target = driver.getTarget();
      Domain domain = domainOf.putIfAbsent(target, driver.getDomain());
      if (domain != null && !domain.equals(driver.getDomain()))
        throw new ElaborationException(ErrorKind.DUPLICATE_DRIVER,
                                       String.format("signal %s is driven from domains %s and %s", target.getName(), domain, driver.getDomain()),
                                       target);
      Driver[] owners = ownerOfBit.computeIfAbsent(target, signal -> new Driver[signal.width()]);
      for (int bit = driver.getStart(); bit < driver.getStop(); ++bit) {
        Driver other = owners[bit];
        if (other != null)
          throw new ElaborationException(ErrorKind.DUPLICATE_DRIVER,
                                         String.format("bit %d of %s is driven by modules %s and %s", bit, target.getName(), other.getModule(),
                                                       driver.getModule()),
                                         target);
        owners[bit] = driver;
      }
      if (driver.getSource().width() != driver.getRangeWidth())
        throw new ElaborationException(ErrorKind.SHAPE_MISMATCH,
                                       String.format("source of width %d drives %d bit(s) of %s", driver.getSource().width(),
                                                     driver.getRangeWidth(), target.getName()),
                                       driver.getSource());
      sources.add(driver.getSource());
    }
    for (Value node : Values.postOrder(sources)) {
      node.shape();
      if (config.lower_arrays && node instanceof ArrayRef)
        throw new IllegalStateException("Array selection left in a lowered driver source: " + node);
    }
    return new DriverTable(drivers);
  }
}
