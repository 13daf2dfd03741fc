package com.example.sourcecleaner.web;

import com.example.sourcecleaner.domain.ArchiveInput;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Packs uploaded zip archives and {@code .py} files into the single zip the cleanup use case
 * reads. A lone zip upload is passed through untouched.
 */
@Component
public class MultipartArchiveInputAdapter {
    private static final String PYTHON_SUFFIX = ".py";

    public ArchiveInput adapt(MultipartFile[] files) throws IOException {
        List<MultipartFile> uploads = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                if (file != null && !file.isEmpty()) {
                    uploads.add(file);
                }
            }
        }
        if (uploads.isEmpty()) {
            throw new IllegalArgumentException("At least one non-empty file must be provided");
        }
        List<Boolean> zipped = new ArrayList<>(uploads.size());
        for (MultipartFile upload : uploads) {
            boolean zip = isZip(upload);
            if (!zip && !isPythonSource(upload)) {
                throw new IllegalArgumentException(
                        "Unsupported upload " + upload.getOriginalFilename()
                                + ": expected a zip archive or a .py file");
            }
            zipped.add(zip);
        }
        if (uploads.size() == 1 && zipped.get(0)) {
            MultipartFile zip = uploads.get(0);
            return new ArchiveInput(zip.getOriginalFilename(), zip::getInputStream);
        }
        return ArchiveInput.ofBytes(archiveName(uploads), pack(uploads, zipped));
    }

    private byte[] pack(List<MultipartFile> uploads, List<Boolean> zipped) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(bytes)) {
            // zip contents keep their own layout, prefixed when several archives are merged
            boolean prefixArchives = zipped.stream().filter(Boolean::booleanValue).count() > 1;
            Set<String> usedPrefixes = new HashSet<>();
            Set<String> usedEntries = new HashSet<>();
            for (int index = 0; index < uploads.size(); index++) {
                MultipartFile upload = uploads.get(index);
                if (zipped.get(index)) {
                    String prefix =
                            prefixArchives
                                    ? uniquePrefix(derivePrefix(upload, index), usedPrefixes) + "/"
                                    : "";
                    copyArchive(upload, prefix, zos, usedEntries);
                } else {
                    String entryName = sanitizeEntryName(upload.getOriginalFilename());
                    if (usedEntries.add(entryName)) {
                        zos.putNextEntry(new ZipEntry(entryName));
                        try (InputStream inputStream = upload.getInputStream()) {
                            inputStream.transferTo(zos);
                        }
                        zos.closeEntry();
                    }
                }
            }
        }
        return bytes.toByteArray();
    }

    private void copyArchive(
            MultipartFile upload, String prefix, ZipOutputStream zos, Set<String> usedEntries)
            throws IOException {
        try (InputStream inputStream = upload.getInputStream();
                ZipInputStream zis = new ZipInputStream(inputStream)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                String entryName = sanitizeEntryName(entry.getName());
                if (entryName.isEmpty() || !usedEntries.add(prefix + entryName)) {
                    continue;
                }
                zos.putNextEntry(new ZipEntry(prefix + entryName));
                zis.transferTo(zos);
                zos.closeEntry();
            }
        }
    }

    private String archiveName(List<MultipartFile> uploads) {
        if (uploads.size() == 1) {
            return stripExtension(Objects.requireNonNullElse(uploads.get(0).getOriginalFilename(), ""))
                            .replaceAll("[^A-Za-z0-9._-]", "_")
                    + ".zip";
        }
        String combined =
                uploads.stream()
                        .map(MultipartFile::getOriginalFilename)
                        .filter(Objects::nonNull)
                        .map(name -> stripExtension(name.strip()).replaceAll("[^A-Za-z0-9._-]", "_"))
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.joining("-"));
        return (combined.isEmpty() ? "combined" : combined) + ".zip";
    }

    private String derivePrefix(MultipartFile file, int index) {
        String originalFilename = file.getOriginalFilename();
        String sanitized =
                originalFilename == null
                        ? ""
                        : stripExtension(originalFilename).replaceAll("[^A-Za-z0-9._-]", "_");
        return sanitized.isBlank() ? "archive-" + (index + 1) : sanitized;
    }

    private String uniquePrefix(String prefix, Set<String> usedPrefixes) {
        String candidate = prefix;
        int counter = 1;
        while (!usedPrefixes.add(candidate)) {
            candidate = prefix + "-" + counter++;
        }
        return candidate;
    }

    private String stripExtension(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        String simple = slash >= 0 ? name.substring(slash + 1) : name;
        int dotIndex = simple.lastIndexOf('.');
        return dotIndex <= 0 ? simple : simple.substring(0, dotIndex);
    }

    /** Drops leading slashes and {@code ..} segments so entries cannot escape the archive root. */
    static String sanitizeEntryName(String entryName) {
        if (entryName == null) {
            return "";
        }
        List<String> segments = new ArrayList<>();
        for (String segment : entryName.replace('\\', '/').split("/")) {
            if (!segment.isEmpty() && !segment.equals("..") && !segment.equals(".")) {
                segments.add(segment);
            }
        }
        return String.join("/", segments);
    }

    private boolean isPythonSource(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name != null
                && name.strip().toLowerCase(Locale.ROOT).endsWith(PYTHON_SUFFIX)
                && !sanitizeEntryName(name).isEmpty();
    }

    private boolean isZip(MultipartFile file) throws IOException {
        try (InputStream inputStream = file.getInputStream()) {
            byte[] signature = inputStream.readNBytes(4);
            if (signature.length < 4) {
                return false;
            }
            return signature[0] == 'P'
                    && signature[1] == 'K'
                    && (signature[2] == 3 || signature[2] == 5 || signature[2] == 7)
                    && signature[3] == signature[2] + 1;
        }
    }
}
