package com.shorthand.notation.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class Parameter {
    @NonNull
    String name;

    @NonNull
    TypeSpec typeSpec;

    @Override
    public String toString() {
        return name + ": " + typeSpec;
    }
}
