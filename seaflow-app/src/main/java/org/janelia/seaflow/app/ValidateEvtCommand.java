package org.janelia.seaflow.app;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

import com.google.common.base.Joiner;
import org.janelia.seaflow.evt.EvtFileValidator;
import org.janelia.seaflow.evt.EvtFileValidator.ValidationResult;

/**
 * Prints a tab separated validation report of EVT files.
 */
class ValidateEvtCommand {

    private static final Joiner TAB_JOINER = Joiner.on('\t');

    private final EvtFileValidator validator;
    private final EvtFileLister evtFileLister;
    private final PrintStream out;

    ValidateEvtCommand(EvtFileValidator validator, EvtFileLister evtFileLister, PrintStream out) {
        this.validator = validator;
        this.evtFileLister = evtFileLister;
        this.out = out;
    }

    /**
     * @return the number of files that failed validation
     */
    int run(ValidateEvtArgs args) throws IOException {
        List<String> files = evtFileLister.readReferences(args.files);
        if (files.isEmpty()) {
            return 0;
        }
        boolean headerPrinted = args.noHeader;
        int ok = 0;
        for (String file : files) {
            ValidationResult result = validator.validate(Paths.get(file));
            if (result.isOk()) {
                ok++;
            }
            if (args.verbose) {
                if (!headerPrinted) {
                    out.println(TAB_JOINER.join("path", "status", "events"));
                    headerPrinted = true;
                }
                out.println(TAB_JOINER.join(file, result.getStatus(), result.isOk() ? result.getEventCount() : "-"));
            } else if (!result.isOk()) {
                if (!headerPrinted) {
                    out.println(TAB_JOINER.join("path", "status"));
                    headerPrinted = true;
                }
                out.println(TAB_JOINER.join(file, result.getStatus()));
            }
        }
        if (!args.noSummary) {
            out.println(String.format("%d/%d files passed validation", ok, files.size()));
        }
        return files.size() - ok;
    }
}
