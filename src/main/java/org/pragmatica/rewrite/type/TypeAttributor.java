package org.pragmatica.rewrite.type;

import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.tree.JavaType;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Syntax;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.visitor.RefactorVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Attaches resolved types to a compilation unit.
 *
 * <p>Classes and methods declared in the unit are added to the type table first, then type
 * references, expressions, invocations and declarations are attributed. Names are resolved
 * through the declared classes, explicit imports, the current package, wildcard imports and
 * {@code java.lang}, in that order; variables through enclosing blocks, method parameters
 * and fields of enclosing classes. Whatever cannot be resolved is left without a type.
 */
public final class TypeAttributor extends RefactorVisitor {
    private static final Logger log = LoggerFactory.getLogger(TypeAttributor.class);

    private final TypeTable types;

    public TypeAttributor(TypeTable types) {
        this.types = types;
    }

    public static Tree.Node attribute(Tree.Node compilationUnit, TypeTable types) {
        return new TypeAttributor(types).visitRoot(compilationUnit);
    }

    @Override
    protected Tree visitCompilationUnit(Tree.Node compilationUnit, Cursor cursor) {
        var context = Context.create(compilationUnit, types);
        return new Attributor(context).visitRoot(compilationUnit);
    }

    /**
     * Per-unit resolution state: declared classes and methods plus name lookup rules.
     */
    private static final class Context {
        private final TypeTable table;
        private final String packageName;
        private final Map<String, String> explicitImports;
        private final List<String> wildcardImports;
        private final Map<String, String> declaredNames;
        private final Map<UUID, JavaType.Class> classesById;
        private final Map<UUID, JavaType.Method> methodsById;

        private Context(TypeTable table,
                        String packageName,
                        Map<String, String> explicitImports,
                        List<String> wildcardImports,
                        Map<String, String> declaredNames,
                        Map<UUID, JavaType.Class> classesById,
                        Map<UUID, JavaType.Method> methodsById) {
            this.table = table;
            this.packageName = packageName;
            this.explicitImports = explicitImports;
            this.wildcardImports = wildcardImports;
            this.declaredNames = declaredNames;
            this.classesById = classesById;
            this.methodsById = methodsById;
        }

        static Context create(Tree.Node unit, TypeTable base) {
            var packageName = Syntax.packageName(unit).orElse("");
            var explicitImports = new HashMap<String, String>();
            var wildcardImports = new ArrayList<String>();
            for (var importNode : Syntax.imports(unit)) {
                if (Syntax.isStaticImport(importNode)) {
                    continue;
                }
                var name = Syntax.importName(importNode);
                if (name.endsWith(".*")) {
                    wildcardImports.add(name.substring(0, name.length() - 2));
                } else {
                    explicitImports.put(name.substring(name.lastIndexOf('.') + 1), name);
                }
            }
            var declarations = new LinkedHashMap<String, Tree.Node>();
            var declaredNames = new HashMap<String, String>();
            for (var classDeclaration : Syntax.classes(unit)) {
                collectDeclarations(classDeclaration, packageName.isEmpty() ? "" : packageName + ".",
                                    declarations, declaredNames);
            }
            var context = new Context(base, packageName, explicitImports, wildcardImports, declaredNames,
                                      new HashMap<>(), new HashMap<>());
            return context.withDeclarations(declarations);
        }

        private static void collectDeclarations(Tree.Node classDeclaration,
                                                String prefix,
                                                Map<String, Tree.Node> declarations,
                                                Map<String, String> declaredNames) {
            var simpleName = Syntax.className(classDeclaration).text();
            var fullName = prefix + simpleName;
            declarations.put(fullName, classDeclaration);
            declaredNames.putIfAbsent(simpleName, fullName);
            Syntax.body(classDeclaration)
                  .ifPresent(body -> body.childrenOfKind(Kind.CLASS_DECLARATION)
                                         .forEach(nested -> collectDeclarations(nested, fullName + ".",
                                                                                declarations, declaredNames)));
        }

        /**
         * Resolve declared class hierarchies and method signatures, then extend the table with them.
         */
        private Context withDeclarations(Map<String, Tree.Node> declarations) {
            var resolved = new HashMap<String, JavaType.Class>();
            for (var name : declarations.keySet()) {
                declaredClass(name, declarations, resolved, new HashSet<>());
            }
            var classes = new ArrayList<JavaType.Class>();
            var classesById = new HashMap<UUID, JavaType.Class>();
            declarations.forEach((name, node) -> {
                classes.add(resolved.get(name));
                classesById.put(node.id(), resolved.get(name));
            });
            var extended = new Context(table.with(classes, List.of()), packageName, explicitImports,
                                       wildcardImports, declaredNames, classesById, new HashMap<>());
            var methods = new ArrayList<JavaType.Method>();
            var methodsById = new HashMap<UUID, JavaType.Method>();
            declarations.forEach((name, node) -> Syntax.body(node).ifPresent(body -> {
                for (var method : body.childrenOfKind(Kind.METHOD_DECLARATION)) {
                    extended.signature(resolved.get(name), method)
                            .ifPresent(signature -> {
                                methods.add(signature);
                                methodsById.put(method.id(), signature);
                            });
                }
            }));
            return new Context(table.with(classes, methods), packageName, explicitImports, wildcardImports,
                               declaredNames, classesById, methodsById);
        }

        private JavaType.Class declaredClass(String name,
                                             Map<String, Tree.Node> declarations,
                                             Map<String, JavaType.Class> resolved,
                                             Set<String> inProgress) {
            var existing = resolved.get(name);
            if (existing != null) {
                return existing;
            }
            inProgress.add(name);
            var node = declarations.get(name);
            boolean cyclic = false;
            for (var typeNode : Syntax.extendsClause(node)) {
                var declared = declaredName(typeNode, declarations);
                if (declared != null && inProgress.contains(declared)) {
                    log.debug("Cyclic type hierarchy: {} extends {}, supertype left unresolved", name, declared);
                    cyclic = true;
                }
            }
            var extendsTypes = Syntax.extendsClause(node)
                                     .stream()
                                     .map(t -> superclass(t, declarations, resolved, inProgress))
                                     .flatMap(Optional::stream)
                                     .toList();
            var implementsTypes = Syntax.implementsClause(node)
                                        .stream()
                                        .map(t -> superclass(t, declarations, resolved, inProgress))
                                        .flatMap(Optional::stream)
                                        .toList();
            JavaType.Class result;
            if (Syntax.isInterface(node)) {
                result = new JavaType.Class(name, List.of(), Optional.empty(), extendsTypes);
            } else {
                var supertype = extendsTypes.isEmpty()
                                ? cyclic ? Optional.<JavaType.Class>empty() : table.lookup(TypeTable.OBJECT)
                                : Optional.of(extendsTypes.get(0));
                result = new JavaType.Class(name, List.of(), supertype, implementsTypes);
            }
            resolved.put(name, result);
            inProgress.remove(name);
            return result;
        }

        private Optional<JavaType.Class> superclass(Tree.Node typeNode,
                                                    Map<String, Tree.Node> declarations,
                                                    Map<String, JavaType.Class> resolved,
                                                    Set<String> inProgress) {
            var declared = declaredName(typeNode, declarations);
            if (declared != null) {
                return inProgress.contains(declared)
                       ? Optional.empty()
                       : Optional.of(declaredClass(declared, declarations, resolved, inProgress));
            }
            return resolveClassName(spelledName(typeNode));
        }

        /**
         * Full name of a class declared in this unit that the type node refers to, or {@code null}.
         */
        private String declaredName(Tree.Node typeNode, Map<String, Tree.Node> declarations) {
            var spelled = spelledName(typeNode);
            var declared = declarations.containsKey(spelled) ? spelled : declaredNames.get(spelled);
            return declared != null && declarations.containsKey(declared) ? declared : null;
        }

        private static String spelledName(Tree.Node typeNode) {
            var raw = typeNode.kind() == Kind.PARAMETERIZED_TYPE ? (Tree.Node) typeNode.child(0) : typeNode;
            return Syntax.qualifiedName(raw);
        }

        private Optional<JavaType.Method> signature(JavaType.Class owner, Tree.Node method) {
            boolean constructor = Syntax.isConstructor(method);
            var name = constructor ? JavaType.CONSTRUCTOR_NAME : Syntax.methodName(method).text();
            Optional<JavaType> returnType = constructor
                                            ? Optional.of(JavaType.Primitive.VOID)
                                            : Syntax.returnType(method).flatMap(this::resolveType);
            if (returnType.isEmpty()) {
                return Optional.empty();
            }
            var parameters = new ArrayList<JavaType>();
            boolean varargs = false;
            for (var parameter : Syntax.parameters(method)) {
                var type = declaredVariableType(parameter);
                if (type.isEmpty()) {
                    return Optional.empty();
                }
                parameters.add(type.get());
                varargs = Syntax.isVarargs(parameter);
            }
            return Optional.of(new JavaType.Method(owner, name, returnType.get(), parameters, varargs));
        }

        Optional<JavaType> declaredVariableType(Tree.Node declarations) {
            var type = resolveType(Syntax.variableType(declarations));
            return Syntax.isVarargs(declarations) ? type.map(JavaType.Array::new) : type;
        }

        /**
         * Resolve a type reference node.
         */
        Optional<JavaType> resolveType(Tree.Node typeNode) {
            return switch (typeNode.kind()) {
                case PRIMITIVE_TYPE -> JavaType.Primitive.fromKeyword(typeNode.text()).map(JavaType.class::cast);
                case IDENTIFIER, FIELD_ACCESS -> resolveClassName(Syntax.qualifiedName(typeNode))
                    .map(JavaType.class::cast);
                case ARRAY_TYPE -> resolveType((Tree.Node) typeNode.child(0)).map(JavaType.Array::new);
                case PARAMETERIZED_TYPE -> parameterized(typeNode);
                default -> Optional.empty();
            };
        }

        private Optional<JavaType> parameterized(Tree.Node typeNode) {
            var base = resolveClassName(Syntax.qualifiedName((Tree.Node) typeNode.child(0)));
            if (base.isEmpty()) {
                return Optional.empty();
            }
            var arguments = new ArrayList<JavaType>();
            for (var argument : typeNode.nodes().subList(1, typeNode.nodes().size())) {
                var resolved = resolveType(argument);
                if (resolved.isEmpty()) {
                    return base.map(JavaType.class::cast);
                }
                arguments.add(resolved.get());
            }
            return Optional.of(base.get().withTypeParameters(arguments));
        }

        /**
         * Resolve a simple or qualified class name.
         */
        Optional<JavaType.Class> resolveClassName(String name) {
            if (name.contains(".")) {
                var direct = table.lookup(name);
                if (direct.isPresent()) {
                    return direct;
                }
                // Outer.Inner spelled through a simple outer name
                int dot = name.indexOf('.');
                return resolveClassName(name.substring(0, dot))
                    .flatMap(outer -> table.lookup(outer.fullyQualifiedName() + name.substring(dot)));
            }
            var declared = declaredNames.get(name);
            if (declared != null) {
                return table.lookup(declared);
            }
            var imported = explicitImports.get(name);
            if (imported != null) {
                return table.lookup(imported);
            }
            var samePackage = table.lookup(packageName.isEmpty() ? name : packageName + "." + name);
            if (samePackage.isPresent()) {
                return samePackage;
            }
            for (var wildcard : wildcardImports) {
                var candidate = table.lookup(wildcard + "." + name);
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
            return table.lookup("java.lang." + name);
        }
    }

    /**
     * Cursored pass attaching types. Ancestors on the cursor are the original trees, so
     * declarations found through it are resolved from source, not from rebuilt nodes.
     */
    private static final class Attributor extends RefactorVisitor {
        private final Context context;

        Attributor(Context context) {
            this.context = context;
        }

        @Override
        protected boolean cursored() {
            return true;
        }

        @Override
        protected Tree visitClassDeclaration(Tree.Node classDeclaration, Cursor cursor) {
            var visited = (Tree.Node) super.visitClassDeclaration(classDeclaration, cursor);
            return visited.withType(Optional.ofNullable(context.classesById.get(classDeclaration.id())));
        }

        @Override
        protected Tree visitMethodDeclaration(Tree.Node method, Cursor cursor) {
            var visited = (Tree.Node) super.visitMethodDeclaration(method, cursor);
            return visited.withType(Optional.ofNullable(context.methodsById.get(method.id())));
        }

        @Override
        protected Tree visitNamedVariable(Tree.Node variable, Cursor cursor) {
            var visited = (Tree.Node) super.visitNamedVariable(variable, cursor);
            var declarations = (Tree.Node) cursor.parentTree().orElseThrow();
            return visited.withType(context.declaredVariableType(declarations));
        }

        @Override
        protected Tree visitIdentifier(Tree.Node identifier, Cursor cursor) {
            var parent = (Tree.Node) cursor.parentTree().orElse(null);
            if (parent == null) {
                return identifier;
            }
            if (parent.kind() == Kind.CLASS_DECLARATION && identifier == Syntax.className(parent)) {
                return identifier.withType(Optional.ofNullable(context.classesById.get(parent.id())));
            }
            if (isTypeReference(identifier, parent)) {
                return identifier.withType(context.resolveType(identifier));
            }
            if (isExpression(identifier, parent)) {
                return identifier.withType(expressionName(identifier, cursor));
            }
            return identifier;
        }

        @Override
        protected Tree visitFieldAccess(Tree.Node fieldAccess, Cursor cursor) {
            var visited = (Tree.Node) super.visitFieldAccess(fieldAccess, cursor);
            var parent = (Tree.Node) cursor.parentTree().orElse(null);
            var asClass = context.resolveClassName(Syntax.qualifiedName(fieldAccess));
            if (asClass.isPresent()) {
                return visited.withType(asClass.get());
            }
            if (parent != null && isExpression(fieldAccess, parent)
                && Syntax.target(fieldAccess).kind() == Kind.IDENTIFIER
                && Syntax.target(fieldAccess).text().equals("this")) {
                var name = Syntax.fieldName(fieldAccess).text();
                return visited.withType(cursor.firstEnclosing(Kind.CLASS_DECLARATION)
                                              .flatMap(c -> fieldType(c, name)));
            }
            return visited;
        }

        @Override
        protected Tree visitPrimitiveType(Tree.Node primitive, Cursor cursor) {
            return primitive.withType(context.resolveType(primitive));
        }

        @Override
        protected Tree visitParameterizedType(Tree.Node parameterized, Cursor cursor) {
            var visited = (Tree.Node) super.visitParameterizedType(parameterized, cursor);
            return visited.withType(context.resolveType(parameterized));
        }

        @Override
        protected Tree visitArrayType(Tree.Node array, Cursor cursor) {
            var visited = (Tree.Node) super.visitArrayType(array, cursor);
            return visited.withType(context.resolveType(array));
        }

        @Override
        protected Tree visitLiteral(Tree.Node literal, Cursor cursor) {
            return literal.withType(literalType(literal.text()));
        }

        @Override
        protected Tree visitParentheses(Tree.Node parentheses, Cursor cursor) {
            var visited = (Tree.Node) super.visitParentheses(parentheses, cursor);
            return visited.withType(expressionType(visited.nodes().get(0)));
        }

        @Override
        protected Tree visitUnary(Tree.Node unary, Cursor cursor) {
            var visited = (Tree.Node) super.visitUnary(unary, cursor);
            if (visited.token("!").isPresent()) {
                return visited.withType(JavaType.Primitive.BOOLEAN);
            }
            return visited.withType(expressionType(visited.nodes().get(0)));
        }

        @Override
        protected Tree visitBinary(Tree.Node binary, Cursor cursor) {
            var visited = (Tree.Node) super.visitBinary(binary, cursor);
            var operator = ((Tree.Token) visited.child(1)).text();
            var left = expressionType(visited.nodes().get(0));
            var right = expressionType(visited.nodes().get(1));
            return switch (operator) {
                case "==", "!=", "<", ">", "<=", ">=", "&&", "||" -> visited.withType(JavaType.Primitive.BOOLEAN);
                case "+" -> isString(left) || isString(right)
                            ? visited.withType(context.table.lookup(TypeTable.STRING).map(JavaType.class::cast))
                            : visited.withType(left);
                default -> visited.withType(left);
            };
        }

        @Override
        protected Tree visitAssignment(Tree.Node assignment, Cursor cursor) {
            var visited = (Tree.Node) super.visitAssignment(assignment, cursor);
            return visited.withType(expressionType(visited.nodes().get(0)));
        }

        @Override
        protected Tree visitMethodInvocation(Tree.Node invocation, Cursor cursor) {
            var visited = (Tree.Node) super.visitMethodInvocation(invocation, cursor);
            var name = Syntax.methodName(visited).text();
            Optional<JavaType.Class> receiver = Syntax.select(visited).isPresent()
                                                ? Syntax.select(visited)
                                                        .flatMap(this::expressionType)
                                                        .filter(JavaType.Class.class::isInstance)
                                                        .map(JavaType.Class.class::cast)
                                                : cursor.firstEnclosing(Kind.CLASS_DECLARATION)
                                                        .map(c -> context.classesById.get(c.id()));
            if (receiver.isEmpty()) {
                log.debug("Unresolved receiver for call to {}", name);
                return visited;
            }
            var method = selectOverload(context.table.methods(receiver.get(), name), Syntax.arguments(visited));
            if (method.isEmpty()) {
                log.debug("No applicable method {} on {}", name, receiver.get().fullyQualifiedName());
            }
            return visited.withType(method.map(JavaType.class::cast));
        }

        @Override
        protected Tree visitNewClass(Tree.Node newClass, Cursor cursor) {
            var visited = (Tree.Node) super.visitNewClass(newClass, cursor);
            var owner = ((Tree.Node) visited.child(1)).type()
                                                        .filter(JavaType.Class.class::isInstance)
                                                        .map(JavaType.Class.class::cast);
            if (owner.isEmpty()) {
                return visited;
            }
            var arguments = Syntax.arguments(visited);
            var constructors = context.table.methods(owner.get(), JavaType.CONSTRUCTOR_NAME)
                                            .stream()
                                            .filter(m -> m.declaringType()
                                                          .fullyQualifiedName()
                                                          .equals(owner.get().fullyQualifiedName()))
                                            .toList();
            if (constructors.isEmpty() && arguments.isEmpty()) {
                return visited.withType(new JavaType.Method(owner.get(), JavaType.CONSTRUCTOR_NAME,
                                                            JavaType.Primitive.VOID, List.of(), false));
            }
            return visited.withType(selectOverload(constructors, arguments)
                                        .map(m -> (JavaType) m.withDeclaringType(owner.get())));
        }

        // === Resolution helpers ===

        private Optional<JavaType.Method> selectOverload(List<JavaType.Method> candidates, List<Tree.Node> arguments) {
            var argumentTypes = arguments.stream()
                                         .map(this::expressionType)
                                         .toList();
            // Methods applicable without boxing win over those that need it
            return candidates.stream()
                             .filter(m -> isApplicable(m, argumentTypes, false))
                             .findFirst()
                             .or(() -> candidates.stream()
                                                 .filter(m -> isApplicable(m, argumentTypes, true))
                                                 .findFirst());
        }

        private static boolean isApplicable(JavaType.Method method,
                                            List<Optional<JavaType>> arguments,
                                            boolean boxing) {
            var parameters = method.parameterTypes();
            if (method.varargs()) {
                if (arguments.size() < parameters.size() - 1) {
                    return false;
                }
            } else if (arguments.size() != parameters.size()) {
                return false;
            }
            for (int i = 0; i < arguments.size(); i++) {
                var argument = arguments.get(i);
                if (argument.isEmpty()) {
                    continue;
                }
                var parameter = parameterAt(method, i, argument.get());
                if (!boxing && needsBoxing(parameter, argument.get())
                    || !TypeUtils.isAssignableTo(parameter, argument.get())) {
                    return false;
                }
            }
            return true;
        }

        private static boolean needsBoxing(JavaType parameter, JavaType argument) {
            if (argument instanceof JavaType.Primitive primitive) {
                return !primitive.equals(JavaType.Primitive.NULL) && !(parameter instanceof JavaType.Primitive);
            }
            return argument instanceof JavaType.Class && parameter instanceof JavaType.Primitive;
        }

        private static JavaType parameterAt(JavaType.Method method, int index, JavaType argument) {
            var parameters = method.parameterTypes();
            if (method.varargs() && index >= parameters.size() - 1) {
                var last = parameters.get(parameters.size() - 1);
                boolean passesArray = index == parameters.size() - 1 && argument instanceof JavaType.Array;
                return passesArray || !(last instanceof JavaType.Array array) ? last : array.elementType();
            }
            return parameters.get(index);
        }

        /**
         * Type of the value an expression evaluates to.
         */
        private Optional<JavaType> expressionType(Tree.Node expression) {
            return expression.type().map(type -> {
                if (type instanceof JavaType.Method method) {
                    return method.isConstructor() ? method.declaringType() : method.returnType();
                }
                return type;
            });
        }

        private Optional<JavaType> expressionName(Tree.Node identifier, Cursor cursor) {
            var name = identifier.text();
            if (name.equals("this")) {
                return cursor.firstEnclosing(Kind.CLASS_DECLARATION)
                             .map(c -> (JavaType) context.classesById.get(c.id()));
            }
            if (name.equals("super")) {
                return cursor.firstEnclosing(Kind.CLASS_DECLARATION)
                             .flatMap(c -> Optional.ofNullable(context.classesById.get(c.id())))
                             .flatMap(JavaType.Class::supertype)
                             .map(JavaType.class::cast);
            }
            var variable = variableType(name, cursor);
            if (variable.isPresent()) {
                return variable;
            }
            return context.resolveClassName(name).map(JavaType.class::cast);
        }

        /**
         * Walk outwards from the identifier: locals declared earlier in enclosing blocks,
         * parameters of the enclosing method, then fields of each enclosing class.
         */
        private Optional<JavaType> variableType(String name, Cursor cursor) {
            Tree child = cursor.tree();
            for (var current = cursor.parent(); current.isPresent(); current = current.get().parent()) {
                var ancestor = (Tree.Node) current.get().tree();
                switch (ancestor.kind()) {
                    case BLOCK -> {
                        var children = ancestor.children();
                        int limit = ancestor.indexOf(child);
                        for (int i = 0; i < limit; i++) {
                            var found = declaredIn(children.get(i), name);
                            if (found.isPresent()) {
                                return found;
                            }
                        }
                    }
                    case METHOD_DECLARATION -> {
                        for (var parameter : Syntax.parameters(ancestor)) {
                            var found = declaredIn(parameter, name);
                            if (found.isPresent()) {
                                return found;
                            }
                        }
                    }
                    case CLASS_DECLARATION -> {
                        var found = fieldType(ancestor, name);
                        if (found.isPresent()) {
                            return found;
                        }
                    }
                    default -> {
                    }
                }
                child = ancestor;
            }
            return Optional.empty();
        }

        private Optional<JavaType> fieldType(Tree.Node classDeclaration, String name) {
            return Syntax.body(classDeclaration)
                         .flatMap(body -> body.children()
                                              .stream()
                                              .map(member -> declaredIn(member, name))
                                              .flatMap(Optional::stream)
                                              .findFirst());
        }

        private Optional<JavaType> declaredIn(Tree statement, String name) {
            if (statement.kind() != Kind.VARIABLE_DECLARATIONS) {
                return Optional.empty();
            }
            var declarations = (Tree.Node) statement;
            boolean declares = Syntax.variables(declarations)
                                     .stream()
                                     .anyMatch(v -> Syntax.variableName(v).text().equals(name));
            return declares ? context.declaredVariableType(declarations) : Optional.empty();
        }

        private Optional<JavaType> literalType(String text) {
            if (text.startsWith("\"")) {
                return context.table.lookup(TypeTable.STRING).map(JavaType.class::cast);
            }
            if (text.startsWith("'")) {
                return Optional.of(JavaType.Primitive.CHAR);
            }
            if (text.equals("true") || text.equals("false")) {
                return Optional.of(JavaType.Primitive.BOOLEAN);
            }
            if (text.equals("null")) {
                return Optional.of(JavaType.Primitive.NULL);
            }
            var lower = text.toLowerCase();
            if (lower.endsWith("l")) {
                return Optional.of(JavaType.Primitive.LONG);
            }
            if (lower.startsWith("0x")) {
                return Optional.of(JavaType.Primitive.INT);
            }
            if (lower.endsWith("f")) {
                return Optional.of(new JavaType.Primitive("float"));
            }
            if (lower.contains(".") || lower.contains("e") || lower.endsWith("d")) {
                return Optional.of(JavaType.Primitive.DOUBLE);
            }
            return Optional.of(JavaType.Primitive.INT);
        }

        private static boolean isString(Optional<JavaType> type) {
            return type.map(t -> TypeUtils.isOfClassType(t, TypeTable.STRING)).orElse(false);
        }

        private static boolean isTypeReference(Tree.Node node, Tree.Node parent) {
            return switch (parent.kind()) {
                case VARIABLE_DECLARATIONS, PARAMETERIZED_TYPE, ARRAY_TYPE, IMPORT, CLASS_DECLARATION -> true;
                case NEW_CLASS, ANNOTATION -> node == parent.child(1);
                case METHOD_DECLARATION -> node != Syntax.methodName(parent);
                default -> false;
            };
        }

        private static boolean isExpression(Tree.Node node, Tree.Node parent) {
            return switch (parent.kind()) {
                case EXPRESSION_STATEMENT, RETURN, IF, ASSIGNMENT, BINARY, UNARY, PARENTHESES -> true;
                case NAMED_VARIABLE -> node != Syntax.variableName(parent);
                case METHOD_INVOCATION -> node != Syntax.methodName(parent);
                case NEW_CLASS, ANNOTATION -> node != parent.child(1);
                case FIELD_ACCESS -> node == Syntax.target(parent);
                default -> false;
            };
        }
    }
}
