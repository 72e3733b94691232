package org.boc.helper;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;

public class TestDefaultHashTable {

    private static final BinaryOperator<Integer> SUM = new BinaryOperator<Integer>() {
        @Override
        public Integer apply(Integer a, Integer b) {
            return a + b;
        }
    };

    @Test
    public void missingKeysGetTheDefault()
    {
        DefaultHashTable<String, Integer> counts = new DefaultHashTable<String, Integer>(0);

        Assert.assertEquals(Integer.valueOf(0), counts.get("absent"));
        Assert.assertTrue(counts.containsKey("absent"));
    }

    @Test
    public void accumulatesFromTheDefault()
    {
        DefaultHashTable<String, Integer> counts = new DefaultHashTable<String, Integer>(10);
        counts.accumulate("a", 1, SUM);
        counts.accumulate("a", 2, SUM);
        counts.accumulate("b", 5, SUM);

        Assert.assertEquals(Integer.valueOf(13), counts.get("a"));
        Assert.assertEquals(Integer.valueOf(15), counts.get("b"));
    }

    @Test
    public void supplierGivesEachKeyItsOwnValue()
    {
        DefaultHashTable<String, List<String>> groups = new DefaultHashTable<String, List<String>>(
                new Supplier<List<String>>() {
                    @Override
                    public List<String> get() {
                        return new ArrayList<String>();
                    }
                });
        groups.get("x").add("one");

        Assert.assertEquals(1, groups.get("x").size());
        Assert.assertTrue(groups.get("y").isEmpty());
    }

    @Test
    public void tuplesCompareByValue()
    {
        Assert.assertEquals(new Tuple<String, Double>("a", 1.0), new Tuple<String, Double>("a", 1.0));
        Assert.assertEquals(new Tuple<String, Double>(null, 1.0).hashCode(), new Tuple<String, Double>(null, 1.0).hashCode());
        Assert.assertNotEquals(new Tuple<String, Double>("a", 1.0), new Tuple<String, Double>("a", 2.0));
        Assert.assertEquals("(a, 1.0)", new Tuple<String, Double>("a", 1.0).toString());
    }
}
