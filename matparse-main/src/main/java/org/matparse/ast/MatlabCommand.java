package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * Command-syntax invocation such as {@code hold on} or {@code save /tmp/x}.
 * The arguments are kept as unparsed text.
 */
public final class MatlabCommand extends Command {

    private final Identifier command;
    private final String args;

    public MatlabCommand(Identifier command, String args) {
        this.command = Objects.requireNonNull(command, "command");
        this.args = Objects.requireNonNull(args, "args");
    }

    public Identifier getCommand() {
        return command;
    }

    public String getArgs() {
        return args;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatlabCommand)) {
            return false;
        }
        MatlabCommand other = (MatlabCommand) o;
        return command.equals(other.command) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(MatlabCommand.class, command, args);
    }

    @Override
    public String toString() {
        return "MatlabCommand(command=" + command + ", args='" + args + "')";
    }
}
