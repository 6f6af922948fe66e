package org.matparse.ast.visitor;

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
 * A visitor over the canonical node hierarchy with one method per concrete
 * node class, so that adding a node kind breaks every visitor at compile time.
 *
 * @param <R> the return type
 * @param <A> the type of the argument passed along the traversal
 */
public interface NodeVisitor<R, A> {

    R visit(NumberLiteral n, A arg);

    R visit(StringLiteral n, A arg);

    R visit(BooleanLiteral n, A arg);

    R visit(Special n, A arg);

    R visit(Array n, A arg);

    R visit(FunHandle n, A arg);

    R visit(AnonFun n, A arg);

    R visit(Identifier n, A arg);

    R visit(ArrayOrFunCall n, A arg);

    R visit(FunCall n, A arg);

    R visit(ArrayRef n, A arg);

    R visit(StructRef n, A arg);

    R visit(UnaryOp n, A arg);

    R visit(BinaryOp n, A arg);

    R visit(TernaryOp n, A arg);

    R visit(Transpose n, A arg);

    R visit(Expression n, A arg);

    R visit(Assignment n, A arg);

    R visit(FunDef n, A arg);

    R visit(While n, A arg);

    R visit(If n, A arg);

    R visit(Elseif n, A arg);

    R visit(Else n, A arg);

    R visit(Switch n, A arg);

    R visit(Case n, A arg);

    R visit(Otherwise n, A arg);

    R visit(Try n, A arg);

    R visit(Catch n, A arg);

    R visit(For n, A arg);

    R visit(End n, A arg);

    R visit(Branch n, A arg);

    R visit(ShellCommand n, A arg);

    R visit(MatlabCommand n, A arg);

    R visit(Comment n, A arg);
}
