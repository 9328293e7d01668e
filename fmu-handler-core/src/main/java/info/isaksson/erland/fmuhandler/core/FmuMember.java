package info.isaksson.erland.fmuhandler.core;

import java.util.zip.ZipEntry;

/** One member of an FMU archive as read at open time: its original entry metadata and content. */
final class FmuMember {

    final ZipEntry entry;
    final byte[] data;

    FmuMember(ZipEntry entry, byte[] data) {
        this.entry = entry;
        this.data = data;
    }

    String name() {
        return entry.getName();
    }
}
