package com.rbdesugar.desugar;

import static com.rbdesugar.ast.Trees.assign;
import static com.rbdesugar.ast.Trees.constant;
import static com.rbdesugar.ast.Trees.copyRef;
import static com.rbdesugar.ast.Trees.emptyTree;
import static com.rbdesugar.ast.Trees.falseLit;
import static com.rbdesugar.ast.Trees.ifThenElse;
import static com.rbdesugar.ast.Trees.insSeq;
import static com.rbdesugar.ast.Trees.integer;
import static com.rbdesugar.ast.Trees.local;
import static com.rbdesugar.ast.Trees.send;
import static com.rbdesugar.ast.Trees.send1;
import static com.rbdesugar.ast.Trees.send3;
import static com.rbdesugar.ast.Trees.trueLit;

import com.rbdesugar.ast.CoreSymbol;
import com.rbdesugar.ast.EmptyTree;
import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.Reference;
import com.rbdesugar.ast.Send;
import com.rbdesugar.ast.SourceLocation;
import com.rbdesugar.ast.UnresolvedConstantLit;
import com.rbdesugar.errors.ErrorClass;
import com.rbdesugar.errors.LoweringException;
import com.rbdesugar.names.Name;
import com.rbdesugar.names.NameTable;
import com.rbdesugar.names.Names;
import com.rbdesugar.parser.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Compound assignment ({@code &&=}, {@code ||=}, {@code op=}) and multiple assignment.
 */
final class DesugarAssignments {

    private final Desugar desugar;

    DesugarAssignments(Desugar desugar) {
        this.desugar = desugar;
    }

    /**
     * The receiver and arguments of a call lvalue, hoisted into temporaries so that they are
     * evaluated exactly once.
     */
    private record HoistedCall(Send original, Name recv, List<Expression> stats, List<Expression> readArgs) {

        Send read(SourceLocation loc) {
            return send(loc, local(loc, recv), original.fun(), copyLocals(readArgs), original.privateOk(), null);
        }

        Send write(SourceLocation loc, Name setter, Expression value) {
            List<Expression> args = copyLocals(readArgs);
            args.add(value);
            return send(loc, local(loc, recv), setter, args, original.privateOk(), null);
        }

        private static List<Expression> copyLocals(List<Expression> locals) {
            List<Expression> copies = new ArrayList<>(locals.size());
            for (Expression arg : locals) {
                copies.add(copyRef((Reference) arg));
            }
            return copies;
        }
    }

    private static HoistedCall hoist(SourceLocation recvLoc, Send call, FreshNames fresh) {
        List<Expression> stats = new ArrayList<>();
        Name tempRecv = fresh.fresh(call.fun());
        stats.add(assign(recvLoc, tempRecv, call.recv()));
        List<Expression> readArgs = new ArrayList<>();
        for (Expression arg : call.args()) {
            SourceLocation argLoc = arg.loc();
            Name name = fresh.fresh(call.fun());
            stats.add(assign(argLoc, name, arg));
            readArgs.add(local(argLoc, name));
        }
        return new HoistedCall(call, tempRecv, stats, readArgs);
    }

    Expression desugarAndAsgn(Node.AndAsgn node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression recv = desugar.node2TreeImpl(node.left(), fresh);
        Expression arg = desugar.node2TreeImpl(node.right(), fresh);

        if (recv instanceof Send call) {
            SourceLocation sendLoc = call.loc();
            HoistedCall hoisted = hoist(sendLoc, call, fresh);
            Name tempResult = fresh.fresh(call.fun());
            List<Expression> stats = new ArrayList<>(hoisted.stats());
            stats.add(assign(sendLoc, tempResult, hoisted.read(sendLoc)));
            Send body = hoisted.write(sendLoc, names().addEq(call.fun()), arg);
            Expression iff = ifThenElse(sendLoc, local(sendLoc, tempResult), body, local(sendLoc, tempResult));
            return insSeq(loc, stats, iff);
        } else if (recv instanceof Reference ref) {
            Expression cond = copyRef(ref);
            Expression body = assign(loc, recv, arg);
            Expression elsep = copyRef(ref);
            return ifThenElse(loc, cond, body, elsep);
        } else if (recv instanceof UnresolvedConstantLit) {
            return constantReassignment(loc);
        }
        throw LoweringException.notImplemented("&&= on a " + recv.type());
    }

    Expression desugarOrAsgn(Node.OrAsgn node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression recv = desugar.node2TreeImpl(node.left(), fresh);
        Expression arg = desugar.node2TreeImpl(node.right(), fresh);

        if (recv instanceof Send call) {
            SourceLocation sendLoc = call.loc();
            HoistedCall hoisted = hoist(sendLoc, call, fresh);
            Name tempResult = fresh.fresh(call.fun());
            List<Expression> stats = new ArrayList<>(hoisted.stats());
            stats.add(assign(sendLoc, tempResult, hoisted.read(sendLoc)));
            Send elsep = hoisted.write(sendLoc, names().addEq(call.fun()), arg);
            Expression iff = ifThenElse(sendLoc, local(sendLoc, tempResult), local(sendLoc, tempResult), elsep);
            return insSeq(loc, stats, iff);
        } else if (recv instanceof Reference ref) {
            Expression cond = copyRef(ref);
            Expression body = assign(loc, recv, arg);
            Expression elsep = copyRef(ref);
            return ifThenElse(loc, cond, elsep, body);
        } else if (recv instanceof UnresolvedConstantLit) {
            return constantReassignment(loc);
        }
        throw LoweringException.notImplemented("||= on a " + recv.type());
    }

    Expression desugarOpAsgn(Node.OpAsgn node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression recv = desugar.node2TreeImpl(node.left(), fresh);
        Expression rhs = desugar.node2TreeImpl(node.right(), fresh);
        Name op = desugar.ctx().intern(node.op());

        if (recv instanceof Send call) {
            SourceLocation sendLoc = call.loc();
            HoistedCall hoisted = hoist(loc, call, fresh);
            Expression newValue = send1(sendLoc, hoisted.read(sendLoc), op, rhs);
            Send res = hoisted.write(sendLoc, names().addEq(call.fun()), newValue);
            return insSeq(loc, hoisted.stats(), res);
        } else if (recv instanceof Reference ref) {
            Expression lhs = copyRef(ref);
            return assign(loc, lhs, send1(loc, recv, op, rhs));
        } else if (recv instanceof UnresolvedConstantLit) {
            return constantReassignment(loc);
        }
        throw LoweringException.notImplemented("op= on a " + recv.type());
    }

    private Expression constantReassignment(SourceLocation loc) {
        desugar.ctx().report(loc, ErrorClass.NO_CONSTANT_REASSIGNMENT, "Constant reassignment is not supported");
        return emptyTree(loc);
    }

    private NameTable names() {
        return desugar.ctx().names();
    }

    /**
     * Destructures {@code rhs} into the targets of {@code lhs}. The value is expanded once
     * into a temporary; targets before a splat read positive indices, targets after it read
     * negative ones, and the splat target takes the slice in between. The statement list
     * evaluates to the temporary.
     */
    Expression desugarMlhs(SourceLocation loc, Node.Mlhs lhs, Expression rhs, FreshNames fresh) {
        List<Expression> stats = new ArrayList<>();
        Name tempName = fresh.fresh(Names.ASSIGN_TEMP);
        int size = lhs.exprs().size();
        int i = 0;
        int before = 0;
        int after = 0;
        boolean didSplat = false;

        for (Node c : lhs.exprs()) {
            if (c instanceof Node.SplatLhs splat) {
                if (didSplat) {
                    throw new LoweringException("did splat already");
                }
                didSplat = true;

                Expression lh = desugar.lowerOrEmpty(splat.var(), splat.loc(), fresh);
                int left = i;
                int right = size - left - 1;
                if (!(lh instanceof EmptyTree)) {
                    SourceLocation lhLoc = lh.loc();
                    Expression exclusive = trueLit(lhLoc);
                    if (right == 0) {
                        right = 1;
                        exclusive = falseLit(lhLoc);
                    }
                    Expression index = send3(lhLoc, constant(lhLoc, CoreSymbol.RANGE), Names.NEW,
                        integer(lhLoc, left), integer(lhLoc, -right), exclusive);
                    stats.add(assign(lhLoc, lh, send1(loc, local(loc, tempName), Names.SLICE, index)));
                }
                i = -right;
            } else {
                if (didSplat) {
                    after++;
                } else {
                    before++;
                }
                Expression val = send1(loc, local(loc, tempName), Names.SQUARE_BRACKETS, integer(loc, i));

                if (c instanceof Node.Mlhs nested) {
                    stats.add(desugarMlhs(nested.loc(), nested, val, fresh));
                } else {
                    Expression lh = desugar.node2TreeImpl(c, fresh);
                    stats.add(assign(lh.loc(), lh, val));
                }
                i++;
            }
        }

        Expression expanded = send3(loc, constant(loc, CoreSymbol.MAGIC), Names.EXPAND_SPLAT,
            rhs, integer(loc, before), integer(loc, after));
        stats.add(0, assign(loc, tempName, expanded));
        return insSeq(loc, stats, local(loc, tempName));
    }
}
