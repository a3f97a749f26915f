package com.project.image.autocrop.DTOs;

import com.project.image.autocrop.model.NameType;
import com.project.image.autocrop.service.FilenameValidator;

import java.util.Objects;

public record NamingSpec(NameType type, String customName) {

    public NamingSpec {
        Objects.requireNonNull(type, "type");
        customName = customName == null ? "" : customName;
    }

    public static NamingSpec original() {
        return new NamingSpec(NameType.ORIGINAL, "name");
    }

    public static NamingSpec custom(String name) {
        return new NamingSpec(NameType.CUSTOM, name);
    }

    /** Only a custom name can be illegal; original names come from files that already exist. */
    public boolean isIllegal() {
        return type == NameType.CUSTOM && FilenameValidator.isIllegal(customName);
    }
}
