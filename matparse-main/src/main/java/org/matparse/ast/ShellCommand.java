package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * A shell escape, {@code !ls -l}. The command is the raw rest of the line.
 */
public final class ShellCommand extends Command {

    private final String command;

    public ShellCommand(String command) {
        this.command = Objects.requireNonNull(command, "command");
    }

    public String getCommand() {
        return command;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ShellCommand && command.equals(((ShellCommand) o).command));
    }

    @Override
    public int hashCode() {
        return Objects.hash(ShellCommand.class, command);
    }

    @Override
    public String toString() {
        return "ShellCommand(command='" + command + "')";
    }
}
