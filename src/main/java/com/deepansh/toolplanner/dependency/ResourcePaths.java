package com.deepansh.toolplanner.dependency;

/**
 * Path-prefix overlap checks on resource identifiers.
 *
 * Purely textual: no normalisation beyond one trailing separator, no symlink or
 * case handling. "/a/bc" and "/a/b" do not overlap, "/a/b" and "/a/b/c" do.
 */
public final class ResourcePaths {

    private ResourcePaths() {
    }

    /**
     * True if the two resources are equal or one is an ancestor of the other.
     * Null or empty resources never overlap anything.
     */
    public static boolean overlaps(String first, String second) {
        if (isEmpty(first) || isEmpty(second)) {
            return false;
        }
        String a = stripTrailingSeparator(first);
        String b = stripTrailingSeparator(second);
        return a.equals(b) || isAncestor(a, b) || isAncestor(b, a);
    }

    /**
     * True if {@code path} is {@code directory} itself or somewhere below it.
     */
    public static boolean isWithin(String path, String directory) {
        if (isEmpty(path) || isEmpty(directory)) {
            return false;
        }
        String dir = stripTrailingSeparator(directory);
        String p = stripTrailingSeparator(path);
        return p.equals(dir) || isAncestor(dir, p);
    }

    static String stripTrailingSeparator(String resource) {
        return isSeparator(resource.charAt(resource.length() - 1))
                ? resource.substring(0, resource.length() - 1)
                : resource;
    }

    private static boolean isAncestor(String parent, String child) {
        return child.length() > parent.length()
                && child.startsWith(parent)
                && isSeparator(child.charAt(parent.length()));
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
