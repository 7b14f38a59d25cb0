/**
 * Copyright 2013 Apigee Corporation.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package io.apigee.rerunner.kernel;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The values of the viewer's input widgets, as seen by one run of a script. Values are strings,
 * booleans or numbers (numbers are stored as Double so that equal states compare equal no matter
 * how they were built). Triggers are momentary flags, such as a button press, that are true only
 * for the run that follows the press.
 * <p>
 * Instances are immutable.
 * </p>
 */
public final class InputState
{
    public static final InputState EMPTY =
        new InputState(new TreeMap<String, Object>(), new TreeSet<String>());

    private final SortedMap<String, Object> values;
    private final SortedSet<String> triggers;

    private InputState(TreeMap<String, Object> values, TreeSet<String> triggers)
    {
        this.values = Collections.unmodifiableSortedMap(values);
        this.triggers = Collections.unmodifiableSortedSet(triggers);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Builder toBuilder()
    {
        Builder b = new Builder();
        b.values.putAll(values);
        b.triggers.addAll(triggers);
        return b;
    }

    public Object get(String id) {
        return values.get(id);
    }

    public boolean contains(String id) {
        return values.containsKey(id) || triggers.contains(id);
    }

    public boolean isTriggered(String id) {
        return triggers.contains(id);
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Set<String> getTriggers() {
        return triggers;
    }

    public boolean isEmpty() {
        return values.isEmpty() && triggers.isEmpty();
    }

    /**
     * Return the same state with every trigger cleared. This is what a run leaves behind.
     */
    public InputState withTriggersReset()
    {
        if (triggers.isEmpty()) {
            return this;
        }
        return new InputState(new TreeMap<String, Object>(values), new TreeSet<String>());
    }

    /**
     * Merge two states that were requested one after the other before the first was used. The newer
     * state wins, except that a trigger set in the older state stays set, so that a button press
     * is never lost just because another widget changed right after it.
     */
    public static InputState coalesce(InputState older, InputState newer)
    {
        if (older == null) {
            return newer;
        }
        if (newer == null) {
            return older;
        }
        Builder b = newer.toBuilder();
        b.triggers.addAll(older.triggers);
        return b.build();
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof InputState)) {
            return false;
        }
        InputState s = (InputState)o;
        return values.equals(s.values) && triggers.equals(s.triggers);
    }

    @Override
    public int hashCode()
    {
        return (values.hashCode() * 31) + triggers.hashCode();
    }

    @Override
    public String toString()
    {
        return "InputState" + values + (triggers.isEmpty() ? "" : " triggers=" + triggers);
    }

    public static final class Builder
    {
        private final TreeMap<String, Object> values = new TreeMap<String, Object>();
        private final TreeSet<String> triggers = new TreeSet<String>();

        Builder()
        {
        }

        public Builder put(String id, String value)
        {
            values.put(id, value);
            return this;
        }

        public Builder put(String id, boolean value)
        {
            values.put(id, Boolean.valueOf(value));
            return this;
        }

        public Builder put(String id, double value)
        {
            values.put(id, Double.valueOf(value));
            return this;
        }

        /**
         * Add a value of any supported type. Numbers are normalized to Double.
         */
        public Builder putValue(String id, Object value)
        {
            if (value instanceof Number) {
                values.put(id, Double.valueOf(((Number)value).doubleValue()));
            } else if ((value instanceof String) || (value instanceof Boolean)) {
                values.put(id, value);
            } else if (value == null) {
                values.remove(id);
            } else {
                throw new IllegalArgumentException("Unsupported input value type " + value.getClass().getName());
            }
            return this;
        }

        public Builder trigger(String id)
        {
            triggers.add(id);
            return this;
        }

        public Builder remove(String id)
        {
            values.remove(id);
            triggers.remove(id);
            return this;
        }

        public InputState build()
        {
            if (values.isEmpty() && triggers.isEmpty()) {
                return EMPTY;
            }
            return new InputState(new TreeMap<String, Object>(values), new TreeSet<String>(triggers));
        }
    }
}
