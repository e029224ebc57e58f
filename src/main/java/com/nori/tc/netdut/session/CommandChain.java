package com.nori.tc.netdut.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 명령 체인 빌더. (불변, 각 호출이 새 인스턴스를 만든다)
 *
 * - then("show_version")  : "_"를 공백으로 바꾼 명령 줄을 추가 -> "show version"
 * - arg("Ethernet1")      : 마지막 줄 끝에 " Ethernet1"을 붙인다
 * - call()                : 모든 줄을 실행하고 마지막 줄의 응답을 돌려준다
 * - add("show clock")     : 원문 줄을 추가하고 바로 실행한다
 *
 * 예: session.chain().then("configure").then("interface").arg("Ethernet1").call()
 */
public final class CommandChain {

    private final DeviceSession session;
    private final List<String> commands;

    CommandChain(DeviceSession session, List<String> commands) {
        this.session = session;
        this.commands = List.copyOf(commands);
    }

    public CommandChain then(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return with(name.replace('_', ' '));
    }

    public CommandChain arg(Object key) {
        if (commands.isEmpty()) {
            throw new IllegalStateException("arg() needs a preceding command");
        }
        List<String> next = new ArrayList<>(commands);
        int last = next.size() - 1;
        next.set(last, next.get(last) + " " + key);
        return new CommandChain(session, next);
    }

    public Object call() {
        if (commands.isEmpty()) {
            throw new IllegalStateException("empty command chain");
        }
        List<Object> replies = session.sendCommands(commands);
        return replies.get(replies.size() - 1);
    }

    public Object add(String line) {
        Objects.requireNonNull(line, "line must not be null");
        return with(line).call();
    }

    public List<String> commands() {
        return commands;
    }

    private CommandChain with(String line) {
        List<String> next = new ArrayList<>(commands);
        next.add(line);
        return new CommandChain(session, next);
    }

    @Override
    public String toString() {
        return "CommandChain" + commands;
    }
}
