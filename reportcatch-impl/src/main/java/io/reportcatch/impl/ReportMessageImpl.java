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

package io.reportcatch.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.reportcatch.ReportAction;
import io.reportcatch.ReportAttribute;
import io.reportcatch.ReportMessage;
import io.reportcatch.ReportObject;
import io.reportcatch.Severity;

/**
 * The mutable report record. Created per emission request by the {@link ReportServer}, and mutated by the catchers
 * (through the {@link CatchChainExecutor}'s context) while the chain pass runs.
 * <p/>
 * Not thread safe: it is only mutated within a chain pass, which holds the executor's lock.
 */
public class ReportMessageImpl implements ReportMessage {
    private Severity _severity;
    private String _id;
    private String _text;
    private int _verbosity;
    private int _action;
    private String _context = "";
    private String _file = "";
    private int _line;
    private ReportObject _reportObject;
    private final ArrayList<ReportAttribute> _attributes = new ArrayList<>();

    public ReportMessageImpl(Severity severity, String id, String text, int verbosity, int action) {
        setSeverity(severity);
        setId(id);
        setText(text);
        _verbosity = verbosity;
        _action = action;
    }

    /**
     * @return a structural copy: all fields, and a separate attribute list holding the same attributes. The report
     *         object is referenced, not copied.
     */
    public ReportMessageImpl copy() {
        ReportMessageImpl copy = new ReportMessageImpl(_severity, _id, _text, _verbosity, _action);
        copy.restoreFrom(this);
        return copy;
    }

    /**
     * Sets every field of this message to the values of the other.
     */
    public void restoreFrom(ReportMessageImpl other) {
        _severity = other._severity;
        _id = other._id;
        _text = other._text;
        _verbosity = other._verbosity;
        _action = other._action;
        _context = other._context;
        _file = other._file;
        _line = other._line;
        _reportObject = other._reportObject;
        _attributes.clear();
        _attributes.addAll(other._attributes);
    }

    // ===== Accessors

    @Override
    public Severity getSeverity() {
        return _severity;
    }

    @Override
    public String getId() {
        return _id;
    }

    @Override
    public String getText() {
        return _text;
    }

    @Override
    public int getVerbosity() {
        return _verbosity;
    }

    @Override
    public int getAction() {
        return _action;
    }

    @Override
    public String getContext() {
        return _context;
    }

    @Override
    public String getFile() {
        return _file;
    }

    @Override
    public int getLine() {
        return _line;
    }

    @Override
    public ReportObject getReportObject() {
        return _reportObject;
    }

    @Override
    public List<ReportAttribute> getAttributes() {
        return Collections.unmodifiableList(new ArrayList<>(_attributes));
    }

    // ===== Mutators

    public ReportMessageImpl setSeverity(Severity severity) {
        if (severity == null) {
            throw new NullPointerException("severity");
        }
        _severity = severity;
        return this;
    }

    public ReportMessageImpl setId(String id) {
        if (id == null) {
            throw new NullPointerException("id");
        }
        _id = id;
        return this;
    }

    public ReportMessageImpl setText(String text) {
        _text = text == null ? "" : text;
        return this;
    }

    public ReportMessageImpl setVerbosity(int verbosity) {
        _verbosity = verbosity;
        return this;
    }

    public ReportMessageImpl setAction(int action) {
        _action = action;
        return this;
    }

    public ReportMessageImpl setContext(String context) {
        _context = context == null ? "" : context;
        return this;
    }

    public ReportMessageImpl setLocation(String file, int line) {
        _file = file == null ? "" : file;
        _line = line;
        return this;
    }

    public ReportMessageImpl setReportObject(ReportObject reportObject) {
        _reportObject = reportObject;
        return this;
    }

    public ReportMessageImpl addAttribute(ReportAttribute attribute) {
        if (attribute == null) {
            throw new NullPointerException("attribute");
        }
        _attributes.add(attribute);
        return this;
    }

    @Override
    public String toString() {
        return "ReportMessage[" + _severity + ":" + _id + ", verbosity:" + _verbosity + ", action:"
                + ReportAction.toString(_action) + "]{" + _text + "}";
    }
}
