package dao.runtime.interpreter;

import dao.runtime.Address;

/**
 * 运行时错误种类，错误值是以种类名为标签的 Data。
 */
public enum ErrorKind {
    UNDEFINED_VARIABLE("UndefinedVariable", "undefined variable"),
    UNDEFINED_MODULE_VARIABLE("UndefinedModuleVariable", "undefined module variable"),
    UNDEFINED_MODULE("UndefinedModule", "no module loaded at address"),
    UNDEFINED_SYSTEM_CALL("UndefinedSystemCall", "no system call at address"),
    UNDEFINED_JUMP_TARGET("UndefinedJumpTarget", "jump target is not defined in the current block"),
    STACK_UNDERFLOW("StackUnderflow", "stack is empty"),
    NOT_ENOUGH_ARGUMENTS("NotEnoughArguments", "not enough arguments for function parameters"),
    TOO_MANY_ARGUMENTS("TooManyArguments", "too many arguments to function"),
    NO_CURRENT_MODULE("NoCurrentModule", "update occurred with no current module"),
    BAD_INSTRUCTION("BadInstruction", "evaluated operator on incorrect type of data"),
    NOT_CALLABLE("NotCallable", "target of call is not executable data"),
    MODULE_ALREADY_ACTIVE("ModuleAlreadyActive", "a module is already active at address"),
    SYSTEM_CALL("SystemCall", "system call failed"),
    LIMIT_EXCEEDED("LimitExceeded", "security policy limit exceeded");

    private final String tagName;
    private final String defaultProblem;
    private final Address tag;

    ErrorKind(String tagName, String defaultProblem) {
        this.tagName = tagName;
        this.defaultProblem = defaultProblem;
        this.tag = Address.of(tagName);
    }

    public String getTagName() {
        return tagName;
    }

    public String getDefaultProblem() {
        return defaultProblem;
    }

    /** 错误值的 Data 标签 */
    public Address getTag() {
        return tag;
    }

    /** 按标签反查，未知返回 null */
    public static ErrorKind fromTag(Address tag) {
        for (ErrorKind kind : values()) {
            if (kind.tag.equals(tag)) return kind;
        }
        return null;
    }
}
