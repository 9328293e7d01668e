package info.isaksson.erland.fmuhandler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Set;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Re-packs an FMU with one replaced member.
 *
 * <p>Members are written in their original order with their original name, compression method,
 * modification time, comment and extra field. The archive is first written to a temporary file
 * next to the target and then moved onto it, so the target is either the old or the complete new
 * archive. The new file keeps the POSIX permissions of the one it replaces.</p>
 */
final class FmuArchiveWriter {

    private static final Logger log = LoggerFactory.getLogger(FmuArchiveWriter.class);

    private FmuArchiveWriter() {}

    static void writeAtomically(Path target, Path permissionSource, List<FmuMember> members, String replacedName,
                                byte[] replacement, String archiveComment, Charset charset) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Path tmp = Files.createTempFile(dir, ".fmu-", ".tmp");
        boolean moved = false;
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
                write(out, members, replacedName, replacement, archiveComment, charset);
            }
            copyPermissions(Files.exists(absolute) ? absolute : permissionSource, tmp);
            move(tmp, absolute);
            moved = true;
        } finally {
            if (!moved) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not delete temporary file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    /** Writes the archive to {@code out} and closes it. */
    static void write(OutputStream out, List<FmuMember> members, String replacedName, byte[] replacement,
                      String archiveComment, Charset charset) throws IOException {
        try (ZipOutputStream zip = new ZipOutputStream(out, charset)) {
            if (archiveComment != null) {
                zip.setComment(archiveComment);
            }
            for (FmuMember m : members) {
                byte[] data = m.name().equals(replacedName) ? replacement : m.data;
                zip.putNextEntry(copyOf(m.entry, data));
                zip.write(data);
                zip.closeEntry();
            }
        }
    }

    /**
     * A fresh entry with the metadata of {@code original}. Sizes and CRC are only set for stored
     * entries; deflated entries get them computed while writing.
     */
    static ZipEntry copyOf(ZipEntry original, byte[] data) {
        ZipEntry e = new ZipEntry(original.getName());
        int method = original.getMethod() == ZipEntry.STORED ? ZipEntry.STORED : ZipEntry.DEFLATED;
        e.setMethod(method);
        if (original.getTime() != -1) {
            e.setTime(original.getTime());
        }
        if (original.getComment() != null) {
            e.setComment(original.getComment());
        }
        if (original.getExtra() != null) {
            e.setExtra(original.getExtra());
        }
        if (method == ZipEntry.STORED) {
            CRC32 crc = new CRC32();
            crc.update(data);
            e.setSize(data.length);
            e.setCompressedSize(data.length);
            e.setCrc(crc.getValue());
        }
        return e;
    }

    /** Temporary files are created owner-only; give {@code tmp} the mode of {@code from} on POSIX file systems. */
    static void copyPermissions(Path from, Path tmp) throws IOException {
        if (from == null || !Files.exists(from)) {
            return;
        }
        if (!Files.getFileStore(tmp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(from);
        Files.setPosixFilePermissions(tmp, permissions);
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
