package com.loglens.core.rule;

/**
 * 方法名通配匹配 (区分大小写)
 */
public final class MethodNamePatterns {

    private MethodNamePatterns() {
    }

    /**
     * 支持：精确、prefix*、*suffix、*contains*
     */
    public static boolean matches(String methodName, String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return false;
        }
        if (pattern.equals(methodName)) {
            return true;
        }
        if (pattern.equals("*")) {
            return true;
        }

        boolean leading = pattern.startsWith("*");
        boolean trailing = pattern.endsWith("*");
        if (leading && trailing) {
            return methodName.contains(pattern.substring(1, pattern.length() - 1));
        }
        if (leading) {
            return methodName.endsWith(pattern.substring(1));
        }
        return trailing && methodName.startsWith(pattern.substring(0, pattern.length() - 1));
    }
}
