package cafe.woden.spellcafe.text;

public enum WordCategory {
  NORMAL,
  CODE_IDENTIFIER,
  ACRONYM,
  PROPER_NOUN,
  TECHNICAL_TERM
}
