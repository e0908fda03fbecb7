package org.e2immu.analyzer.incremental.engine.scope;

import org.e2immu.analyzer.incremental.common.ProtocolViolationException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/*
Owns all scopes of one module. Scopes refer to their parent by handle, and resolve it here.
Handles are never reused: after a reset, the handle of a dropped scope resolves to nothing.
 */
public class ScopeArena {
    public static final int NO_PARENT = -1;

    private final Map<Integer, EnvironmentRecord> scopes = new HashMap<>();
    private int nextHandle;

    int register(EnvironmentRecord environmentRecord) {
        int handle = nextHandle++;
        scopes.put(handle, environmentRecord);
        return handle;
    }

    public EnvironmentRecord get(int handle) {
        if (handle == NO_PARENT) return null;
        return scopes.get(handle);
    }

    public boolean contains(EnvironmentRecord environmentRecord) {
        return scopes.get(environmentRecord.handle()) == environmentRecord;
    }

    void checkOwnership(EnvironmentRecord parent) {
        if (parent != null && !contains(parent)) {
            throw new ProtocolViolationException("Parent scope " + parent.name() + " does not belong to this arena");
        }
    }

    /**
     * Drop every scope except the root; used when the module is about to analyze a new tree.
     */
    public void retainOnly(EnvironmentRecord root) {
        scopes.values().removeIf(s -> s != root);
    }

    public Collection<EnvironmentRecord> scopes() {
        return Collections.unmodifiableCollection(scopes.values());
    }

    public int size() {
        return scopes.size();
    }
}
