package com.motaz.insight.engine.publish;

import com.motaz.insight.engine.aggregate.RunReport;

public interface ResultPublisher {

    void publish(RunReport report);
}
