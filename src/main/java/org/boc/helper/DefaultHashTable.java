package org.boc.helper;

import java.util.HashMap;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;

/**
 * A map that hands out a supplied default for missing keys instead of null, and stores it.
 */
public class DefaultHashTable<K,V> extends HashMap<K,V> {

    private final Supplier<V> supplier;

    public DefaultHashTable(final V defaultVal)
    {
        this.supplier = new Supplier<V>() {
            @Override
            public V get() {
                return defaultVal;
            }
        };
    }

    public DefaultHashTable(Supplier<V> supplier)
    {
        this.supplier = supplier;
    }

    @Override
    public V get(Object key)
    {
        if(!this.containsKey(key))
        {
            super.put((K)key, this.supplier.get());
        }
        return super.get(key);
    }

    /**
     * Folds value into the entry for key, starting from the default.
     */
    public V accumulate(K key, V value, BinaryOperator<V> combiner)
    {
        V combined = combiner.apply(get(key), value);
        super.put(key, combined);
        return combined;
    }
}
