package vscope.io;

import vscope.scope.ScopeLabel;

public sealed interface ScopeEvent permits ScopeEvent.Enter, ScopeEvent.Exit, ScopeEvent.Signal {
    int line();

    record Enter(ScopeLabel label, int line) implements ScopeEvent {}

    record Exit(int line) implements ScopeEvent {}

    record Signal(String name, int line) implements ScopeEvent {}
}
