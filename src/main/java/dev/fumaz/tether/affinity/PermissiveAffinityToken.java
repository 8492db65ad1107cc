package dev.fumaz.tether.affinity;

/**
 * An {@link AffinityToken} that accepts every sequence, for configurations that skip affinity checking.
 */
public final class PermissiveAffinityToken implements AffinityToken {

    static final PermissiveAffinityToken INSTANCE = new PermissiveAffinityToken();

    private PermissiveAffinityToken() {
    }

    @Override
    public boolean check() {
        return true;
    }

    @Override
    public void detach() {
    }

    @Override
    public boolean isBound() {
        return false;
    }

    @Override
    public String toString() {
        return "PermissiveAffinityToken";
    }
}
