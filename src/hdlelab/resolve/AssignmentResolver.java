package hdlelab.resolve;

import hdlelab.control.ControlFlowCompiler;
import hdlelab.control.PriorityChain;
import hdlelab.stmt.Assign;
import hdlelab.stmt.Domain;
import hdlelab.stmt.IfStatement;
import hdlelab.stmt.Statement;
import hdlelab.stmt.SwitchStatement;
import hdlelab.value.ArrayRef;
import hdlelab.value.Cat;
import hdlelab.value.Const;
import hdlelab.value.Operator;
import hdlelab.value.Signal;
import hdlelab.value.Value;
import hdlelab.value.Values;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Merges the assignments of a module body into one multiplexed driver per (domain, signal).
 *
 * The body is executed symbolically. Each (domain, signal) pair holds the expression for its current value and the set of bits
 * written so far. Within a linear body the last write wins. A priority chain runs each arm from the state before the chain and
 * merges the results on exit as <code>g1 ? v1 : g2 ? v2 : ... : default</code>. Before the first write, a comb signal holds its
 * reset value and a synchronous signal holds itself (unchanged).
 */
public class AssignmentResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Driver namespace key. */
  public record Target(Domain domain, Signal signal) {}

  private static final class Binding {
    final Value value;
    final BitSet driven;
    Binding(Value value, BitSet driven) {
      this.value = value;
      this.driven = driven;
    }
  }

  private static final class State {
    final LinkedHashMap<Target, Binding> bindings;
    State() { this.bindings = new LinkedHashMap<>(); }
    State(State other) { this.bindings = new LinkedHashMap<>(other.bindings); }
  }

  private final ControlFlowCompiler compiler;

  public AssignmentResolver(ControlFlowCompiler compiler) { this.compiler = Objects.requireNonNull(compiler, "compiler"); }

  /**
   * Resolves a statement list into drivers, one per contiguous run of driven bits of each (domain, signal).
   * @param statements the module body
   * @param moduleName hierarchical module name recorded in the drivers
   * @return the drivers in order of first assignment
   * @throws hdlelab.elab.ElaborationException for invalid patterns or out-of-range constant indices
   */
  public List<Driver> resolve(List<Statement> statements, String moduleName) {
    State state = new State();
    execute(statements, state);
    List<Driver> drivers = new ArrayList<>();
    for (Map.Entry<Target, Binding> entry : state.bindings.entrySet()) {
      Target target = entry.getKey();
      Binding binding = entry.getValue();
      int width = target.signal().width();
      for (int start = binding.driven.nextSetBit(0); start >= 0; start = binding.driven.nextSetBit(start)) {
        int stop = binding.driven.nextClearBit(start);
        Value source = (start == 0 && stop == width) ? binding.value : binding.value.slice(start, stop);
        drivers.add(new Driver(target.domain(), target.signal(), start, stop, source, moduleName));
        start = stop;
      }
    }
    logger.debug("Module {}: {} statement(s) resolved into {} driver(s)", moduleName, statements.size(), drivers.size());
    return drivers;
  }

  private void execute(List<Statement> body, State state) {
    for (Statement statement : body) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        assign(state, assign.getDomain(), assign.getTarget(), assign.getSource(), statement);
      } else if (statement instanceof IfStatement || statement instanceof SwitchStatement) {
        executeChain(compiler.compile(statement), state);
      } else {
        throw new IllegalArgumentException("Unknown statement type " + statement.getClass().getName());
      }
    }
  }

  private void executeChain(PriorityChain chain, State state) {
    State base = new State(state);
    List<State> armStates = new ArrayList<>();
    for (PriorityChain.Arm arm : chain.getArms()) {
      State armState = new State(base);
      execute(arm.body(), armState);
      armStates.add(armState);
    }
    State defaultState = new State(base);
    execute(chain.getDefaultBody(), defaultState);

    Set<Target> touched = new LinkedHashSet<>();
    armStates.forEach(armState -> touched.addAll(armState.bindings.keySet()));
    touched.addAll(defaultState.bindings.keySet());

    for (Target target : touched) {
      Binding before = base.bindings.get(target);
      Value fallback = before != null ? before.value : initialValue(target);
      Value merged = valueOf(defaultState, target, fallback);
      BitSet driven = (BitSet)drivenOf(defaultState, target).clone();
      for (int i = armStates.size() - 1; i >= 0; --i) {
        Value armValue = valueOf(armStates.get(i), target, fallback);
        driven.or(drivenOf(armStates.get(i), target));
        if (armValue != merged)
          merged = Operator.mux(chain.getArms().get(i).guard(), armValue, merged);
      }
      if (before != null && before.value == merged && before.driven.equals(driven))
        continue;
      state.bindings.put(target, new Binding(merged, driven));
    }
  }

  private static Value valueOf(State state, Target target, Value fallback) {
    Binding binding = state.bindings.get(target);
    return binding != null ? binding.value : fallback;
  }

  private static BitSet drivenOf(State state, Target target) {
    Binding binding = state.bindings.get(target);
    return binding != null ? binding.driven : new BitSet();
  }

  /** Value of a target before any assignment: the reset value for comb, the signal itself (unchanged) for synchronous domains. */
  static Value initialValue(Target target) {
    Signal signal = target.signal();
    if (target.domain().isComb())
      return Const.of(signal.getReset(), signal.shape());
    return signal;
  }

  private void assign(State state, Domain domain, Value target, Value source, Statement origin) {
    ArrayRef variable = LValueBits.findVariableIndex(target);
    if (variable != null) {
      // Write element i when the index equals i
      List<PriorityChain.Arm> arms = new ArrayList<>();
      List<Value> elements = variable.getElements();
      for (int i = 0; i < elements.size(); ++i) {
        Value elementTarget = LValueBits.substitute(target, variable, elements.get(i));
        arms.add(new PriorityChain.Arm(variable.getIndex().eq(Const.of(i)), List.of(new Assign(domain, elementTarget, source))));
      }
      executeChain(new PriorityChain(origin, arms, List.of()), state);
      return;
    }

    List<LValueBits.TargetBit> bits = LValueBits.flatten(target);
    Value resized = Values.resize(source, bits.size());

    // signal -> (signal bit -> source bit)
    LinkedHashMap<Signal, int[]> mappings = new LinkedHashMap<>();
    for (int i = 0; i < bits.size(); ++i) {
      LValueBits.TargetBit bit = bits.get(i);
      int[] mapping = mappings.computeIfAbsent(bit.signal(), signal -> newMapping(signal.width()));
      mapping[bit.bit()] = i;
    }
    for (Map.Entry<Signal, int[]> entry : mappings.entrySet()) {
      Target key = new Target(domain, entry.getKey());
      Binding current = state.bindings.get(key);
      Value currentValue = current != null ? current.value : initialValue(key);
      BitSet driven = current != null ? (BitSet)current.driven.clone() : new BitSet();
      int[] mapping = entry.getValue();
      for (int b = 0; b < mapping.length; ++b)
        if (mapping[b] >= 0)
          driven.set(b);
      state.bindings.put(key, new Binding(splice(currentValue, resized, mapping), driven));
    }
  }

  private static int[] newMapping(int width) {
    int[] mapping = new int[width];
    Arrays.fill(mapping, -1);
    return mapping;
  }

  /**
   * Builds the new value of a signal whose bit b takes source bit mapping[b], or keeps bit b of the old value where mapping[b] is -1.
   */
  static Value splice(Value old, Value source, int[] mapping) {
    int width = mapping.length;
    boolean identity = source.width() == width;
    for (int b = 0; identity && b < width; ++b)
      identity = mapping[b] == b;
    if (identity)
      return source;

    List<Value> runs = new ArrayList<>();
    int b = 0;
    while (b < width) {
      boolean fromSource = mapping[b] >= 0;
      int first = fromSource ? mapping[b] : b;
      int end = b + 1;
      while (end < width && (mapping[end] >= 0) == fromSource && (fromSource ? mapping[end] : end) == first + (end - b))
        ++end;
      Value base = fromSource ? source : old;
      int length = end - b;
      runs.add((first == 0 && length == base.width()) ? base : base.slice(first, first + length));
      b = end;
    }
    return runs.size() == 1 ? runs.get(0) : new Cat(runs);
  }
}
