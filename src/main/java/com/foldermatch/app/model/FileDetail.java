package com.foldermatch.app.model;

import java.util.Optional;

/**
 * Uma linha da comparacao arquivo a arquivo de um par de pastas. Ao menos um lado existe.
 */
public record FileDetail(String fileName, boolean duplicate, FileSide left, FileSide right) {

    public Optional<FileSide> leftSide() {
        return Optional.ofNullable(left);
    }

    public Optional<FileSide> rightSide() {
        return Optional.ofNullable(right);
    }

    public boolean hasLeft() {
        return left != null;
    }

    public boolean hasRight() {
        return right != null;
    }
}
