package org.janelia.seaflow.app;

import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandDescription = "Validate EVT files")
class ValidateEvtArgs {
    @Parameter(description = "EVT file paths. - to read them from stdin")
    List<String> files = new ArrayList<>();
    @Parameter(names = "-noHeader", description = "Don't print column headers", arity = 0)
    boolean noHeader = false;
    @Parameter(names = "-noSummary", description = "Don't print the final summary line", arity = 0)
    boolean noSummary = false;
    @Parameter(names = "-verbose", description = "Show all files. Without it only files with errors are printed", arity = 0)
    boolean verbose = false;
}
