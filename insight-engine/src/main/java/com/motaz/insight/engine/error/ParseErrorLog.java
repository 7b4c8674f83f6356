package com.motaz.insight.engine.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ParseErrorLog {

    private final List<ParseError> entries = new ArrayList<>();

    public synchronized void append(ParseError error) {
        entries.add(error);
    }

    public synchronized List<ParseError> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized int size() {
        return entries.size();
    }
}
