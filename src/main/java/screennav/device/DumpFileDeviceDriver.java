package screennav.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import screennav.detect.UiHierarchyParser;
import screennav.model.CatalogIO;
import screennav.model.NavigationAction;
import screennav.model.UiNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Read-only driver that replays a UI dump saved to disk.
 *
 * <p>{@code .xml} files are parsed as uiautomator hierarchies, anything else
 * as a JSON {@link UiNode} tree. The file is re-read on every dump so it can
 * be swapped while the process runs. Actions are not supported.
 */
public class DumpFileDeviceDriver implements DeviceDriver {

    private static final Logger log = LoggerFactory.getLogger(DumpFileDeviceDriver.class);

    private final String serial;
    private final Path   dumpFile;

    public DumpFileDeviceDriver(String serial, Path dumpFile) {
        this.serial   = serial;
        this.dumpFile = dumpFile;
    }

    @Override
    public String getSerial() {
        return serial;
    }

    @Override
    public UiNode dumpUiTree() throws DriverException {
        if (!Files.isRegularFile(dumpFile)) {
            throw new DeviceUnavailableException("Dump file not found: " + dumpFile);
        }
        try {
            String content = Files.readString(dumpFile);
            log.debug("[{}] Read {} chars from {}", serial, content.length(), dumpFile);
            if (dumpFile.getFileName().toString().toLowerCase().endsWith(".xml")) {
                return UiHierarchyParser.parse(content);
            }
            return CatalogIO.getMapper().readValue(content, UiNode.class);
        } catch (IOException | UiHierarchyParser.HierarchyParseException e) {
            throw new DriverException("Cannot read dump " + dumpFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void execute(NavigationAction action) throws DriverException {
        throw new DriverException("Dump-file device " + serial + " cannot execute: " + action.describe());
    }
}
