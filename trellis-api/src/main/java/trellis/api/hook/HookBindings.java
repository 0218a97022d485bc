package trellis.api.hook;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Ordered entry and exit hooks per (level, scope id). Hook inheritance is already flattened by
 * the discovery collaborator: a list is run as a plain sequence.
 *
 * <p>Scope ids per level: {@link HookLevel#SESSION} uses {@link #SESSION_SCOPE}, {@link
 * HookLevel#MODULE} the module name, {@link HookLevel#CLASS} and {@link HookLevel#TEST} the
 * declaring class name (test-level hooks run around every test of the class).
 *
 * <p>Hooks bound with the {@code beforeEvery}/{@code afterEvery} methods apply to every scope
 * instance of their level. Entry hooks of that kind run before the scope's own entry hooks, exit
 * hooks of that kind after the scope's own exit hooks.
 */
public final class HookBindings {
  public static final String SESSION_SCOPE = "session";

  private static final HookBindings EMPTY = new Builder().build();

  private final ImmutableTable<HookLevel, String, ImmutableList<Hook>> entryHooks;
  private final ImmutableTable<HookLevel, String, ImmutableList<Hook>> exitHooks;
  private final ImmutableListMultimap<HookLevel, Hook> everyEntryHooks;
  private final ImmutableListMultimap<HookLevel, Hook> everyExitHooks;

  private HookBindings(Builder builder) {
    this.entryHooks = freeze(builder.entryHooks);
    this.exitHooks = freeze(builder.exitHooks);
    this.everyEntryHooks = ImmutableListMultimap.copyOf(builder.everyEntryHooks);
    this.everyExitHooks = ImmutableListMultimap.copyOf(builder.everyExitHooks);
  }

  public static HookBindings empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableList<Hook> entryHooks(HookLevel level, String scopeId) {
    ImmutableList<Hook> hooks = entryHooks.get(level, scopeId);
    return ImmutableList.<Hook>builder()
        .addAll(everyEntryHooks.get(level))
        .addAll(hooks == null ? ImmutableList.of() : hooks)
        .build();
  }

  public ImmutableList<Hook> exitHooks(HookLevel level, String scopeId) {
    ImmutableList<Hook> hooks = exitHooks.get(level, scopeId);
    return ImmutableList.<Hook>builder()
        .addAll(hooks == null ? ImmutableList.of() : hooks)
        .addAll(everyExitHooks.get(level))
        .build();
  }

  private static ImmutableTable<HookLevel, String, ImmutableList<Hook>> freeze(
      Table<HookLevel, String, ImmutableList.Builder<Hook>> table) {
    ImmutableTable.Builder<HookLevel, String, ImmutableList<Hook>> frozen =
        ImmutableTable.builder();
    for (Table.Cell<HookLevel, String, ImmutableList.Builder<Hook>> cell : table.cellSet()) {
      frozen.put(cell.getRowKey(), cell.getColumnKey(), cell.getValue().build());
    }
    return frozen.build();
  }

  public static final class Builder {
    private final Table<HookLevel, String, ImmutableList.Builder<Hook>> entryHooks =
        HashBasedTable.create();
    private final Table<HookLevel, String, ImmutableList.Builder<Hook>> exitHooks =
        HashBasedTable.create();
    private final ListMultimap<HookLevel, Hook> everyEntryHooks = ArrayListMultimap.create();
    private final ListMultimap<HookLevel, Hook> everyExitHooks = ArrayListMultimap.create();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder beforeSession(Hook hook) {
      return entry(HookLevel.SESSION, SESSION_SCOPE, hook);
    }

    @CanIgnoreReturnValue
    public Builder afterSession(Hook hook) {
      return exit(HookLevel.SESSION, SESSION_SCOPE, hook);
    }

    @CanIgnoreReturnValue
    public Builder beforeModule(String module, Hook hook) {
      return entry(HookLevel.MODULE, module, hook);
    }

    @CanIgnoreReturnValue
    public Builder afterModule(String module, Hook hook) {
      return exit(HookLevel.MODULE, module, hook);
    }

    @CanIgnoreReturnValue
    public Builder beforeClass(String className, Hook hook) {
      return entry(HookLevel.CLASS, className, hook);
    }

    @CanIgnoreReturnValue
    public Builder afterClass(String className, Hook hook) {
      return exit(HookLevel.CLASS, className, hook);
    }

    @CanIgnoreReturnValue
    public Builder beforeTest(String className, Hook hook) {
      return entry(HookLevel.TEST, className, hook);
    }

    @CanIgnoreReturnValue
    public Builder afterTest(String className, Hook hook) {
      return exit(HookLevel.TEST, className, hook);
    }

    @CanIgnoreReturnValue
    public Builder beforeEveryModule(Hook hook) {
      return everyEntry(HookLevel.MODULE, hook);
    }

    @CanIgnoreReturnValue
    public Builder afterEveryModule(Hook hook) {
      return everyExit(HookLevel.MODULE, hook);
    }

    @CanIgnoreReturnValue
    public Builder beforeEveryClass(Hook hook) {
      return everyEntry(HookLevel.CLASS, hook);
    }

    @CanIgnoreReturnValue
    public Builder afterEveryClass(Hook hook) {
      return everyExit(HookLevel.CLASS, hook);
    }

    @CanIgnoreReturnValue
    public Builder beforeEveryTest(Hook hook) {
      return everyEntry(HookLevel.TEST, hook);
    }

    @CanIgnoreReturnValue
    public Builder afterEveryTest(Hook hook) {
      return everyExit(HookLevel.TEST, hook);
    }

    /** Binds an entry hook to every scope instance of {@code level}. */
    @CanIgnoreReturnValue
    public Builder everyEntry(HookLevel level, Hook hook) {
      checkArgument(level != HookLevel.SESSION, "The session has a single scope instance");
      everyEntryHooks.put(level, hook);
      return this;
    }

    /** Binds an exit hook to every scope instance of {@code level}. */
    @CanIgnoreReturnValue
    public Builder everyExit(HookLevel level, Hook hook) {
      checkArgument(level != HookLevel.SESSION, "The session has a single scope instance");
      everyExitHooks.put(level, hook);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder entry(HookLevel level, String scopeId, Hook hook) {
      add(entryHooks, level, scopeId, hook);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder exit(HookLevel level, String scopeId, Hook hook) {
      add(exitHooks, level, scopeId, hook);
      return this;
    }

    private static void add(
        Table<HookLevel, String, ImmutableList.Builder<Hook>> table,
        HookLevel level,
        String scopeId,
        Hook hook) {
      ImmutableList.Builder<Hook> hooks = table.get(level, scopeId);
      if (hooks == null) {
        hooks = ImmutableList.builder();
        table.put(level, scopeId, hooks);
      }
      hooks.add(hook);
    }

    public HookBindings build() {
      return new HookBindings(this);
    }
  }
}
