package de.mirkosertic.filesearch.index;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The configured drives in configuration order.
 */
public class DriveRegistry {

    private final Map<String, DriveHandle> handles;

    public DriveRegistry(final List<DriveSpec> drives) {
        final Map<String, DriveHandle> map = new LinkedHashMap<>();
        for (final DriveSpec drive : drives) {
            if (map.putIfAbsent(drive.id(), new DriveHandle(drive)) != null) {
                throw new IllegalArgumentException("Duplicate drive id: " + drive.id());
            }
        }
        this.handles = Collections.unmodifiableMap(map);
    }

    public @Nullable DriveHandle get(final String driveId) {
        return handles.get(driveId);
    }

    /**
     * @throws IllegalArgumentException if no drive with this id is configured
     */
    public DriveHandle require(final String driveId) {
        final DriveHandle handle = handles.get(driveId);
        if (handle == null) {
            throw new IllegalArgumentException("Unknown drive: " + driveId);
        }
        return handle;
    }

    public List<DriveHandle> all() {
        return List.copyOf(handles.values());
    }

    public List<String> ids() {
        return List.copyOf(handles.keySet());
    }
}
