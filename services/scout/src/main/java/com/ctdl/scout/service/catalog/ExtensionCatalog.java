package com.ctdl.scout.service.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named groups of file extensions. A group holds one extension or several synonyms ({@code jpg}, {@code jpeg}).
 */
public final class ExtensionCatalog {

    /** Every file type the downloader knows how to search for. */
    public static final ExtensionCatalog FILE_TYPES = builder()
            .add("Adobe Flash", "swf")
            .add("Adobe Portable Document Format", "pdf")
            .add("Adobe PostScript", "ps")
            .add("Autodesk Design Web Format", "dwf")
            .add("Google Earth", "kml", "kmz")
            .add("GPS eXchange Format", "gpx")
            .add("Hancom Hanword", "hwp")
            .add("HTML", "htm", "html")
            .add("Microsoft Excel", "xls", "xlsx")
            .add("Microsoft PowerPoint", "ppt", "pptx")
            .add("Microsoft Word", "doc", "docx")
            .add("Microsoft Office macro document", "docm", "xlsm", "pptm")
            .add("OpenOffice presentation", "odp")
            .add("OpenOffice spreadsheet", "ods")
            .add("OpenOffice text", "odt")
            .add("Rich Text Format", "rtf")
            .add("Scalable Vector Graphics", "svg")
            .add("TeX/LaTeX", "tex")
            .add("Text", "txt")
            .add("Comma separated values", "csv")
            .add("Electronic publication", "epub")
            .add("JPEG image", "jpg", "jpeg")
            .add("PNG image", "png")
            .add("GIF image", "gif")
            .add("MP3 audio", "mp3")
            .add("MPEG-4 video", "mp4")
            .add("ZIP archive", "zip")
            .add("RAR archive", "rar")
            .add("7-Zip archive", "7z")
            .add("Tar archive", "tar", "gz", "tgz")
            .add("Disk image", "iso")
            .add("Basic source code", "bas")
            .add("C/C++ source code", "c", "cc", "cpp", "cxx", "h", "hpp")
            .add("C# source code", "cs")
            .add("Java source code", "java")
            .add("Perl source code", "pl")
            .add("Python source code", "py")
            .add("Wireless Markup Language", "wml")
            .add("XML", "xml")
            .add("Windows executable", "exe")
            .add("Windows screensaver", "scr")
            .add("Windows batch file", "bat", "cmd")
            .add("MS-DOS program", "com", "pif")
            .add("Windows installer", "msi")
            .add("Dynamic link library", "dll")
            .add("Control panel item", "cpl")
            .add("Windows shortcut", "lnk")
            .add("Registry file", "reg")
            .add("HTML application", "hta")
            .add("VBScript", "vbs", "vbe")
            .add("JScript", "js", "jse")
            .add("Windows Script File", "wsf")
            .add("PowerShell script", "ps1")
            .add("Java archive", "jar")
            .add("Android package", "apk")
            .build();

    /** File types commonly used to carry malware. Every entry also appears in {@link #FILE_TYPES}. */
    public static final ExtensionCatalog THREATS = builder()
            .add("Windows executable", "exe")
            .add("Windows screensaver", "scr")
            .add("Windows batch file", "bat", "cmd")
            .add("MS-DOS program", "com", "pif")
            .add("Windows installer", "msi")
            .add("Dynamic link library", "dll")
            .add("Control panel item", "cpl")
            .add("Windows shortcut", "lnk")
            .add("Registry file", "reg")
            .add("HTML application", "hta")
            .add("VBScript", "vbs", "vbe")
            .add("JScript", "js", "jse")
            .add("Windows Script File", "wsf")
            .add("PowerShell script", "ps1")
            .add("Java archive", "jar")
            .add("Android package", "apk")
            .add("Microsoft Office macro document", "docm", "xlsm", "pptm")
            .build();

    private final Map<String, Set<String>> entries;

    private ExtensionCatalog(Map<String, Set<String>> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Canonical name to its extensions, in catalog order.
     */
    public Map<String, Set<String>> entries() {
        return entries;
    }

    public boolean contains(String extension) {
        for (Set<String> extensions : entries.values()) {
            if (extensions.contains(extension)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> allExtensions() {
        Set<String> all = new LinkedHashSet<>();
        entries.values().forEach(all::addAll);
        return all;
    }

    public static final class Builder {
        private final Map<String, Set<String>> entries = new LinkedHashMap<>();

        public Builder add(String name, String... extensions) {
            if (extensions.length == 0) {
                throw new IllegalArgumentException("No extensions given for " + name);
            }
            entries.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(List.of(extensions))));
            return this;
        }

        public ExtensionCatalog build() {
            return new ExtensionCatalog(new LinkedHashMap<>(entries));
        }
    }
}
