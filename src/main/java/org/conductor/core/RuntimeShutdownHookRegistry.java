package org.conductor.core;

/**
 * Registers hooks with {@link Runtime#getRuntime()}.
 */
public final class RuntimeShutdownHookRegistry implements IShutdownHookRegistry {

    @Override
    public void addShutdownHook(final Thread hook) {
        Runtime.getRuntime().addShutdownHook(hook);
    }

    @Override
    public boolean removeShutdownHook(final Thread hook) {
        return Runtime.getRuntime().removeShutdownHook(hook);
    }
}
