package org.javai.twine.ast;

public enum Severity {
	INFO,
	WARNING,
	ERROR
}
