package org.matparse.ast.visitor;

import org.matparse.ast.Node;
import org.matparse.ast.NumberLiteral;
import org.matparse.ast.StringLiteral;
import org.matparse.ast.BooleanLiteral;
import org.matparse.ast.Special;
import org.matparse.ast.Array;
import org.matparse.ast.FunHandle;
import org.matparse.ast.AnonFun;
import org.matparse.ast.Identifier;
import org.matparse.ast.ArrayOrFunCall;
import org.matparse.ast.FunCall;
import org.matparse.ast.ArrayRef;
import org.matparse.ast.StructRef;
import org.matparse.ast.UnaryOp;
import org.matparse.ast.BinaryOp;
import org.matparse.ast.TernaryOp;
import org.matparse.ast.Transpose;
import org.matparse.ast.Expression;
import org.matparse.ast.Assignment;
import org.matparse.ast.FunDef;
import org.matparse.ast.While;
import org.matparse.ast.If;
import org.matparse.ast.Elseif;
import org.matparse.ast.Else;
import org.matparse.ast.Switch;
import org.matparse.ast.Case;
import org.matparse.ast.Otherwise;
import org.matparse.ast.Try;
import org.matparse.ast.Catch;
import org.matparse.ast.For;
import org.matparse.ast.End;
import org.matparse.ast.Branch;
import org.matparse.ast.ShellCommand;
import org.matparse.ast.MatlabCommand;
import org.matparse.ast.Comment;

/**
 * A {@link NodeVisitor} whose methods all fall back to
 * {@link #defaultAction(Node, Object)}; subclasses override the kinds they
 * care about.
 */
public abstract class GenericVisitorWithDefaults<R, A> implements NodeVisitor<R, A> {

    /**
     * Called for every node kind that is not overridden. Returns {@code null}
     * unless redefined.
     */
    public R defaultAction(Node n, A arg) {
        return null;
    }

    @Override
    public R visit(NumberLiteral n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(StringLiteral n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BooleanLiteral n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Special n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Array n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FunHandle n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(AnonFun n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Identifier n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ArrayOrFunCall n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FunCall n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ArrayRef n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(StructRef n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnaryOp n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BinaryOp n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(TernaryOp n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Transpose n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Expression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Assignment n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FunDef n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(While n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(If n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Elseif n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Else n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Switch n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Case n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Otherwise n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Try n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Catch n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(For n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(End n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Branch n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ShellCommand n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(MatlabCommand n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Comment n, A arg) {
        return defaultAction(n, arg);
    }
}
