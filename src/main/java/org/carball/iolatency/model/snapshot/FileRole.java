package org.carball.iolatency.model.snapshot;

/**
 * Role of a database file as reported by {@code sys.master_files.type_desc}.
 */
public enum FileRole {
    DATA("ROWS", "Data File"),
    LOG("LOG", "Transaction Log"),
    OTHER(null, "Other");

    private final String typeDesc;
    private final String displayName;

    FileRole(String typeDesc, String displayName) {
        this.typeDesc = typeDesc;
        this.displayName = displayName;
    }

    public String getTypeDesc() {
        return typeDesc;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Maps an engine file type ({@code ROWS}, {@code LOG}, {@code FILESTREAM}, ...) to a role.
     */
    public static FileRole fromTypeDesc(String typeDesc) {
        if (typeDesc == null) {
            return OTHER;
        }
        String normalized = typeDesc.trim().toUpperCase();
        for (FileRole role : values()) {
            if (normalized.equals(role.typeDesc)) {
                return role;
            }
        }
        return OTHER;
    }
}
