@org.springframework.modulith.NamedInterface("api")
package cafe.woden.spellcafe.check.api;
