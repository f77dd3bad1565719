package com.whosly.guard.access;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Role permission strings grouped into the family that grants each access type.
 * {@link AccessType#MISC} has no family.
 */
public class PermissionCatalog {

    public static final Set<String> DEFAULT_READ_PERMISSIONS = Set.of(
            "table:select", "query:execute", "database:view", "table:view");
    public static final Set<String> DEFAULT_WRITE_PERMISSIONS = Set.of(
            "table:insert", "table:update", "table:delete", "query:execute:dml");
    public static final Set<String> DEFAULT_ADMIN_PERMISSIONS = Set.of(
            "table:create", "table:alter", "table:drop", "database:create", "database:drop", "query:execute:ddl");

    private final Map<AccessType, Set<String>> families = new EnumMap<>(AccessType.class);

    public PermissionCatalog(Collection<String> read, Collection<String> write, Collection<String> admin) {
        families.put(AccessType.READ, Collections.unmodifiableSet(new LinkedHashSet<>(read)));
        families.put(AccessType.WRITE, Collections.unmodifiableSet(new LinkedHashSet<>(write)));
        families.put(AccessType.ADMIN, Collections.unmodifiableSet(new LinkedHashSet<>(admin)));
    }

    public static PermissionCatalog defaults() {
        return new PermissionCatalog(DEFAULT_READ_PERMISSIONS, DEFAULT_WRITE_PERMISSIONS, DEFAULT_ADMIN_PERMISSIONS);
    }

    public Set<String> getFamily(AccessType accessType) {
        return families.getOrDefault(accessType, Collections.emptySet());
    }

    /**
     * @return true if at least one granted permission belongs to the family of
     * {@code accessType}; always false for {@link AccessType#MISC}
     */
    public boolean permits(Collection<String> granted, AccessType accessType) {
        Set<String> family = getFamily(accessType);
        if (family.isEmpty() || granted == null) {
            return false;
        }
        for (String permission : granted) {
            if (family.contains(permission)) {
                return true;
            }
        }
        return false;
    }
}
