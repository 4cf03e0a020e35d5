package info.isaksson.erland.javatoseq.model;

import java.nio.file.Path;

/**
 * One place in the program that invokes (or references) a method.
 *
 * @param line 1-based line, or -1 when the parser recorded no position
 */
public record CallSite(String moduleName, Path file, int line, String expression) {

    @Override
    public String toString() {
        String f = file == null ? "?" : file.getFileName().toString();
        return moduleName + ":" + f + ":" + line + " " + expression;
    }
}
