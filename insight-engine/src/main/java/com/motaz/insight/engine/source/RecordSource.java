package com.motaz.insight.engine.source;

import com.motaz.insight.engine.model.RawRecord;

import java.util.List;

public interface RecordSource {

    String name();

    List<RawRecord> read();
}
