package ai.nda.redline.document;

/**
 * A top-level unit of document content: either a paragraph or a table whose cells hold further blocks.
 */
public sealed interface Block permits ParagraphBlock, TableBlock {
}
