package org.janelia.seaflow.app;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.janelia.seaflow.evt.FileIdentity;
import org.janelia.seaflow.fetch.RemoteObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the EVT file references of a run.
 */
class EvtFileLister {

    private static final Logger LOG = LoggerFactory.getLogger(EvtFileLister.class);
    private static final String STDIN_REFERENCE = "-";

    private final InputStream stdin;

    EvtFileLister() {
        this(System.in);
    }

    EvtFileLister(InputStream stdin) {
        this.stdin = stdin;
    }

    /**
     * Expand a single "-" argument into the non blank lines read from stdin.
     */
    List<String> readReferences(List<String> args) throws IOException {
        if (args.size() == 1 && STDIN_REFERENCE.equals(args.get(0))) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            return reader.lines()
                    .map(String::trim)
                    .filter(StringUtils::isNotEmpty)
                    .collect(Collectors.toList());
        }
        return new ArrayList<>(args);
    }

    List<String> listFiles(List<String> args) throws IOException {
        List<String> references = readReferences(args);
        List<String> evtFiles = references.stream()
                .filter(FileIdentity::isEvtFile)
                .collect(Collectors.toList());
        if (evtFiles.size() < references.size()) {
            LOG.info("Ignored {} references that do not look like EVT files", references.size() - evtFiles.size());
        }
        return evtFiles;
    }

    List<String> listDirectory(Path evtDir) throws IOException {
        try (Stream<Path> files = Files.walk(evtDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(Path::toString)
                    .filter(FileIdentity::isEvtFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * List the EVT objects stored under the cruise's prefix in the remote store.
     */
    List<String> listRemote(RemoteObjectStore remoteStore, String cruise) {
        List<String> keys = remoteStore.listObjects(cruise + "/");
        List<String> evtFiles = keys.stream()
                .filter(FileIdentity::isEvtFile)
                .collect(Collectors.toList());
        LOG.info("Found {} EVT files for cruise {} in the remote store", evtFiles.size(), cruise);
        return evtFiles;
    }

    static List<String> limit(List<String> references, Optional<Integer> limit) {
        return limit
                .filter(n -> n < references.size())
                .map(n -> references.subList(0, n))
                .orElse(references);
    }
}
