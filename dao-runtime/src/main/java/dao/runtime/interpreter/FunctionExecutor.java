package dao.runtime.interpreter;

import com.daolang.ir.code.DaoFunc;
import com.daolang.ir.code.Expression;
import com.daolang.ir.code.Lookup;
import dao.runtime.Address;
import dao.runtime.DaoAtom;
import dao.runtime.DaoString;
import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interpreter helper: the call, goto and system-call protocol.
 *
 * <p>Package-private class that holds a reference to the owning Interpreter
 * and works directly on its frame fields. Nested calls recurse through
 * {@link Interpreter#run()}; the caller frame lives in a local
 * {@link FrameSnapshot} for the duration of the call.</p>
 *
 * <p>A callee that ends with RETURN gets the caller frame restored. A callee
 * that runs off the end of its block does not: its registers, stack and
 * exhausted block stay current, so the caller's loop stops as well.</p>
 */
final class FunctionExecutor {

    private static final Logger LOG = Logger.getLogger(FunctionExecutor.class.getName());

    final Interpreter interp;

    FunctionExecutor(Interpreter interp) {
        this.interp = interp;
    }

    /**
     * LOCAL: call a function in the current module context and push the result.
     */
    DaoValue callLocal(Expression expr) {
        List<DaoValue> args = evaluateAll(expr.getOperands());
        DaoValue target = interp.lookup(expr.getTarget());
        DaoValue result = invoke(target, args, FrameSnapshot.capture(interp, false));
        interp.push(result);
        return result;
    }

    /**
     * CALL: switch to the target module, resolve the target there and call it.
     * The caller's module comes back only when the callee returns.
     */
    DaoValue callModule(Expression expr) {
        LoadedModule module = interp.getRegistry().requireModule(expr.getAddress());
        List<DaoValue> args = evaluateAll(expr.getOperands());
        FrameSnapshot caller = FrameSnapshot.capture(interp, true);
        interp.currentModule = module.getModule();
        DaoValue target = interp.lookup(expr.getTarget());
        return invoke(target, args, caller);
    }

    /**
     * Bind arguments, run the body and translate RETURN into a result.
     *
     * <p>The callee starts with the values left over after binding. The
     * caller's own stack object is untouched and comes back as it was when
     * {@code caller} was captured.</p>
     *
     * @param caller  frame to reinstate when the callee returns
     */
    DaoValue invoke(DaoValue target, List<DaoValue> args, FrameSnapshot caller) {
        if (!(target instanceof DaoFunc)) {
            throw VmErrors.notCallable(target);
        }
        DaoFunc func = (DaoFunc) target;
        if (func.getBody().isEmpty()) {
            return interp.lastResult;
        }

        List<DaoValue> available = new ArrayList<>(interp.stack);
        available.addAll(args);
        Map<Label, DaoValue> bound = bind(func.getParams(), available);
        List<DaoValue> leftover = available.subList(func.getParams().size(), available.size());

        interp.checkCallDepth();
        interp.registers = bound;
        interp.stack = new ArrayList<>(leftover);
        interp.enterBlock(func.getBody());

        interp.callDepth++;
        try {
            return interp.run();
        } catch (ControlFlow cf) {
            if (!cf.isReturn()) throw cf;
            caller.restore(interp);
            return cf.getValue();
        } finally {
            interp.callDepth--;
        }
    }

    /**
     * GOTO: replace the current frame with a fresh one for the target. Nothing
     * is saved, so there is no point to come back to.
     */
    DaoValue goTo(Expression expr) {
        DaoValue target = interp.lookup(expr.getTarget());
        if (!(target instanceof DaoFunc)) {
            throw VmErrors.badInstruction(expr, "target of GOTO is non-function data type");
        }
        DaoFunc func = (DaoFunc) target;
        List<DaoValue> args = evaluateAll(expr.getOperands());
        if (func.getBody().isEmpty()) {
            return interp.lastResult;
        }
        Map<Label, DaoValue> bound = bind(func.getParams(), args);
        interp.registers = bound;
        interp.stack = new ArrayList<>(args.subList(func.getParams().size(), args.size()));
        interp.enterBlock(func.getBody());
        return interp.lastResult;
    }

    /**
     * SYS: run a native function with the stack temporarily replaced by the
     * arguments. The stack is put back whether or not the call fails.
     */
    DaoValue systemCall(Expression expr) {
        Address address = expr.getAddress();
        SystemCall function = interp.getRegistry().requireSystemCall(address);
        List<DaoValue> args = expr.isForwardStack()
                ? new ArrayList<>(interp.stack)
                : evaluateAll(expr.getOperands());

        ArrayList<DaoValue> saved = interp.stack;
        interp.stack = new ArrayList<>(args);
        try {
            DaoValue result = function.call(interp);
            return result == null ? DaoAtom.NULL : result;
        } catch (ControlFlow cf) {
            if (cf.isReturn()) return cf.getValue();
            throw VmErrors.systemCallFailed(address, cf.getValue());
        } catch (DaoRuntimeException e) {
            throw VmErrors.systemCallFailed(address, e.getErrorValue());
        } catch (RuntimeException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.log(Level.FINE, "system call " + address + " failed", e);
            }
            throw VmErrors.systemCallFailed(address, DaoString.of(e.toString()));
        } finally {
            interp.stack = saved;
        }
    }

    // ── helpers ──

    private Map<Label, DaoValue> bind(List<Label> params, List<DaoValue> available) {
        if (available.size() < params.size()) {
            throw VmErrors.notEnoughArguments(params, available);
        }
        Map<Label, DaoValue> bound = new HashMap<>();
        for (int i = 0; i < params.size(); i++) {
            bound.put(params.get(i), available.get(i));
        }
        return bound;
    }

    private List<DaoValue> evaluateAll(List<Lookup> lookups) {
        List<DaoValue> values = new ArrayList<>(lookups.size());
        for (Lookup l : lookups) {
            values.add(interp.lookup(l));
        }
        return values;
    }
}
