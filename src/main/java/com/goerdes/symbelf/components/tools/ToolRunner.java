package com.goerdes.symbelf.components.tools;

import com.goerdes.symbelf.exception.FileProcessingException;

import java.util.List;

public interface ToolRunner {

    /**
     * Runs the given executable to completion and returns what it wrote to standard output.
     * The exit status is not interpreted; callers judge success by matching the output.
     *
     * @param executable command name or path
     * @param arguments  arguments passed after the executable
     * @return decoded standard output, possibly empty
     * @throws FileProcessingException if the process cannot be started or waited for
     */
    String run(String executable, List<String> arguments);

}
