package org.janelia.seaflow.app;

import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

/**
 * Arguments of the filter command. Unset numeric options fall back to the application properties.
 */
@Parameters(commandDescription = "Filter EVT files and save the optimally positioned particles (OPP)")
class FilterEvtArgs {
    @Parameter(description = "EVT file references. - to read them from stdin")
    List<String> files = new ArrayList<>();
    @Parameter(names = "-evtDir", description = "EVT directory searched recursively for EVT files")
    String evtDir;
    @Parameter(names = "-remote", description = "Read EVT files from the remote object store. Without EVT file references all EVT files under <cruise>/ are listed", arity = 0)
    boolean remote = false;
    @Parameter(names = "-db", description = "SQLite3 db file. With -gzDb the file is compressed to <db>.gz after filtering")
    String db;
    @Parameter(names = "-binaryDir", description = "Directory for the OPP binary files. Created if it does not exist")
    String binaryDir;
    @Parameter(names = "-cruise", description = "Cruise name", required = true)
    String cruise;
    @Parameter(names = "-notch1", description = "Notch of detector 1")
    Double notch1;
    @Parameter(names = "-notch2", description = "Notch of detector 2")
    Double notch2;
    @Parameter(names = "-width", description = "Alignment band width")
    Double width;
    @Parameter(names = "-origin", description = "Alignment origin")
    Double origin;
    @Parameter(names = "-offset", description = "Focus boundary offset")
    Double offset;
    @Parameter(names = "-workers", description = "Number of filter workers")
    Integer workers;
    @Parameter(names = "-noIndex", description = "Don't create SQLite3 indexes", arity = 0)
    boolean noIndex = false;
    @Parameter(names = "-noOppDb", description = "Don't save OPP particles to the db", arity = 0)
    boolean noOppDb = false;
    @Parameter(names = "-gzDb", description = "gzip compress the output db", arity = 0)
    boolean gzDb = false;
    @Parameter(names = "-gzBinary", description = "gzip compress the output binary files", arity = 0)
    boolean gzBinary = false;
    @Parameter(names = "-progress", description = "Progress update % resolution")
    Double progress;
    @Parameter(names = "-limit", description = "Limit how many files to process")
    Integer limit;
}
