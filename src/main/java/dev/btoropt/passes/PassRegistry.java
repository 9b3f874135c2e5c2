package dev.btoropt.passes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class PassRegistry {
    private final Map<String, Pass> byName = new LinkedHashMap<>();

    /** Every pass this tool ships, transforms first. */
    public static PassRegistry standard() {
        PassRegistry reg = new PassRegistry();
        reg.register(new RenameInputs());
        reg.register(new InitAllStates());
        reg.register(new RenumberLids());
        reg.register(new LowerModules());
        reg.register(new CheckLidOrdering());
        reg.register(new CheckReferences());
        reg.register(new CheckSorts());
        reg.register(new CheckFlat());
        return reg;
    }

    public void register(Pass pass) {
        Objects.requireNonNull(pass, "pass");
        Objects.requireNonNull(pass.name(), "pass.name");
        if (byName.putIfAbsent(pass.name(), pass) != null) {
            throw new IllegalArgumentException("pass `" + pass.name() + "` is already registered");
        }
    }

    public Optional<Pass> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public List<Pass> all() {
        return List.copyOf(byName.values());
    }

    public Map<String, Pass> byName() {
        return Collections.unmodifiableMap(byName);
    }
}
