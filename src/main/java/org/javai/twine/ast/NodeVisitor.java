package org.javai.twine.ast;

/**
 * Visitor over the closed {@link Node} variant set.
 * <p>
 * Adding a node variant adds a method here, so every consumer is forced to
 * decide how to handle it.
 *
 * @param <R> the result type of the visit
 */
public interface NodeVisitor<R> {

	R visitText(Node.Text node);

	R visitLiteral(Node.Literal node);

	R visitVariableRef(Node.VariableRef node);

	R visitRawExpression(Node.RawExpression node);

	R visitPropertyAccess(Node.PropertyAccess node);

	R visitArrayAccess(Node.ArrayAccess node);

	R visitLengthOf(Node.LengthOf node);

	R visitDatamapKeys(Node.DatamapKeys node);

	R visitDatamapValues(Node.DatamapValues node);

	R visitArrayLast(Node.ArrayLast node);

	R visitAssignment(Node.Assignment node);

	R visitConditional(Node.Conditional node);

	R visitElsif(Node.Elsif node);

	R visitElse(Node.Else node);

	R visitForLoop(Node.ForLoop node);

	R visitChoice(Node.Choice node);

	R visitGoto(Node.Goto node);

	R visitPrint(Node.Print node);

	R visitBinaryOp(Node.BinaryOp node);

	R visitLogicalOp(Node.LogicalOp node);

	R visitUnaryOp(Node.UnaryOp node);

	R visitContains(Node.Contains node);

	R visitArrayLiteral(Node.ArrayLiteral node);

	R visitTableLiteral(Node.TableLiteral node);

	R visitDatasetLiteral(Node.DatasetLiteral node);

	R visitRandomChoice(Node.RandomChoice node);

	R visitRandomNumber(Node.RandomNumber node);

	R visitRange(Node.Range node);

	R visitNamedHook(Node.NamedHook node);

	R visitHookUpdate(Node.HookUpdate node);

	R visitHookVisibility(Node.HookVisibility node);

	R visitEventListener(Node.EventListener node);

	R visitLiveUpdate(Node.LiveUpdate node);

	R visitError(Node.Error node);

	R visitWarning(Node.Warning node);
}
