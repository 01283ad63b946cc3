package org.javai.twine.ast;

public enum VisibilityOperation {
	SHOW,
	HIDE
}
