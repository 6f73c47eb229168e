// com/owldsl/output/OutputService.java
package com.owldsl.output;

import com.owldsl.definition.ClassDefinition;

import java.io.IOException;

public interface OutputService extends AutoCloseable {
    void initialize() throws IOException;

    /**
     * Write every prompt of the definition and its row in the definitions table
     */
    void writeDefinition(ClassDefinition definition);

    void writeExplanation(String prompt, String explanation);

    long getWrittenRecords();

    void flush();

    @Override
    void close() throws IOException;
}
