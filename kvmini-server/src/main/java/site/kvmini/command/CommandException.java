package site.kvmini.command;

import site.kvmini.protocol.Errors;

/**
 * 命令执行失败，消息就是返回给客户端的错误文本（含错误前缀）。
 *
 * @author hnfy258
 * @since 1.0
 */
public class CommandException extends RuntimeException {

    public static final String SYNTAX_ERROR = "ERR syntax error";

    public static final String NOT_INTEGER = "ERR value is not an integer or out of range";

    public CommandException(String errorReply) {
        super(errorReply, null, false, false);
    }

    public static CommandException syntaxError() {
        return new CommandException(SYNTAX_ERROR);
    }

    public static CommandException notInteger() {
        return new CommandException(NOT_INTEGER);
    }

    public static CommandException invalidExpireTime(String commandName) {
        return new CommandException("ERR invalid expire time in '" + commandName + "' command");
    }

    public static CommandException noSuchKey() {
        return new CommandException("ERR no such key");
    }

    public static CommandException indexOutOfRange() {
        return new CommandException("ERR index out of range");
    }

    public static CommandException wrongArgCount(String commandName) {
        return new CommandException("ERR wrong number of arguments for '" + commandName + "' command");
    }

    public Errors toErrors() {
        return new Errors(getMessage());
    }
}
