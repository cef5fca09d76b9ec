package com.goerdes.symbelf.model;

/**
 * Symbol of a C++ binary. Demangled names such as
 * <code>ns::Foo&lt;int&gt;::bar(int, char const*) const</code> are split into namespace
 * (<code>ns::Foo&lt;int&gt;</code>), bare name (<code>bar</code>) and arguments
 * (<code>(int, char const*) const</code>).
 */
public class CppSymbol extends Symbol {

    private static final String SCOPE_SEPARATOR = "::";

    public CppSymbol(String mangledName, String displayName, boolean demangled) {
        super(mangledName, displayName, demangled);
    }

    @Override
    protected void initNames() {
        String name = getDisplayName();
        if (!isDemangled()) {
            setBareName(name);
            return;
        }

        String fullName = name;
        int argumentsStart = findArgumentsStart(name);
        if (argumentsStart > 0) {
            fullName = name.substring(0, argumentsStart);
            setArguments(name.substring(argumentsStart));
        }

        int scopeEnd = findLastTopLevelScopeSeparator(fullName);
        if (scopeEnd >= 0) {
            setNamespace(fullName.substring(0, scopeEnd));
            setBareName(fullName.substring(scopeEnd + SCOPE_SEPARATOR.length()));
        } else {
            setBareName(fullName);
        }
    }

    /**
     * Index of the opening parenthesis of the trailing argument list, or -1. A closing
     * parenthesis followed by a scope separator belongs to the scope, e.g.
     * <code>(anonymous namespace)::counter</code>.
     */
    static int findArgumentsStart(String name) {
        int close = name.lastIndexOf(')');
        if (close < 0 || name.indexOf(SCOPE_SEPARATOR, close) >= 0) {
            return -1;
        }
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            char c = name.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    static int findLastTopLevelScopeSeparator(String name) {
        int depth = 0;
        int last = -1;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '<' || c == '(') {
                depth++;
            } else if (c == '>' || c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && name.startsWith(SCOPE_SEPARATOR, i)) {
                last = i;
                i++;
            }
        }
        return last;
    }
}
