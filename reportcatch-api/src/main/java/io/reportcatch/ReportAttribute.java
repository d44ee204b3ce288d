/*
 * Copyright 2015-2025 Endre Stølsvik
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.reportcatch;

import java.util.Objects;

/**
 * A named, typed value attached to a {@link ReportMessage}. Attributes are kept in the order they were added, and
 * names need not be unique.
 */
public final class ReportAttribute {
    public enum Type {
        INT,

        STRING,

        OBJECT
    }

    private final String _name;
    private final Type _type;
    private final Object _value;

    private ReportAttribute(String name, Type type, Object value) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        _name = name;
        _type = type;
        _value = value;
    }

    public static ReportAttribute ofInt(String name, long value) {
        return new ReportAttribute(name, Type.INT, value);
    }

    public static ReportAttribute ofString(String name, String value) {
        return new ReportAttribute(name, Type.STRING, value);
    }

    /**
     * The object is held by reference, and not copied.
     */
    public static ReportAttribute ofObject(String name, Object value) {
        return new ReportAttribute(name, Type.OBJECT, value);
    }

    public String getName() {
        return _name;
    }

    public Type getType() {
        return _type;
    }

    public Object getValue() {
        return _value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReportAttribute)) {
            return false;
        }
        ReportAttribute that = (ReportAttribute) o;
        return _name.equals(that._name) && _type == that._type && Objects.equals(_value, that._value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_name, _type, _value);
    }

    @Override
    public String toString() {
        return _name + ":" + _type + "=" + _value;
    }
}
